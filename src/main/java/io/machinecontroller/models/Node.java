package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.machinecontroller.util.ResourceCopier;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import static io.machinecontroller.config.Constants.KIND_NODE;
import static io.machinecontroller.config.Constants.MACHINE_ANNOTATION_KEY;

/**
 * A provisioned compute instance. Only observed, never written.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node extends ClusterResource {

    @JsonProperty("spec")
    private NodeSpec spec = new NodeSpec();

    public Node() {
        super(KIND_NODE);
    }

    public Node(String name, String providerId) {
        this();
        getMetadata().setName(name);
        this.spec.setProviderId(providerId);
    }

    @JsonIgnore
    public String getProviderId() {
        return spec == null ? null : spec.getProviderId();
    }

    /**
     * @return the "namespace/name" machine link annotation, or null when absent
     */
    @JsonIgnore
    public String getMachineAnnotation() {
        return getMetadata() == null ? null : getMetadata().getAnnotation(MACHINE_ANNOTATION_KEY);
    }

    @Override
    public Node deepCopy() {
        return ResourceCopier.deepCopy(this, Node.class);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeSpec {
        @JsonProperty("providerID")
        private String providerId;
    }
}
