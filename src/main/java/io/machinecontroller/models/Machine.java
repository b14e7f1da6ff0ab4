package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.machinecontroller.util.ResourceCopier;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import static io.machinecontroller.config.Constants.KIND_MACHINE;

/**
 * Declarative descriptor for one instance.
 *
 * The provider ID and node reference are filled in asynchronously once provisioning
 * completes; either may be absent at any observation.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Machine extends ClusterResource {

    @JsonProperty("spec")
    private MachineSpec spec = new MachineSpec();

    @JsonProperty("status")
    private MachineStatus status = new MachineStatus();

    public Machine() {
        super(KIND_MACHINE);
    }

    public Machine(String namespace, String name) {
        this();
        getMetadata().setNamespace(namespace);
        getMetadata().setName(name);
    }

    @JsonIgnore
    public String getProviderId() {
        return spec == null ? null : spec.getProviderId();
    }

    /**
     * @return the name of the linked Node, or null when no Node is linked yet
     */
    @JsonIgnore
    public String getNodeRefName() {
        if (status == null || status.getNodeRef() == null) {
            return null;
        }
        return status.getNodeRef().getName();
    }

    @Override
    public Machine deepCopy() {
        return ResourceCopier.deepCopy(this, Machine.class);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineSpec {
        @JsonProperty("providerID")
        private String providerId;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineStatus {
        @JsonProperty("nodeRef")
        private ObjectReference nodeRef;
    }
}
