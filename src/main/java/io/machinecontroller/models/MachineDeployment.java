package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.machinecontroller.util.ResourceCopier;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import static io.machinecontroller.config.Constants.KIND_MACHINE_DEPLOYMENT;

/**
 * Higher-level scalable group descriptor owning one or more MachineSets.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineDeployment extends ClusterResource {

    @JsonProperty("spec")
    private MachineDeploymentSpec spec = new MachineDeploymentSpec();

    public MachineDeployment() {
        super(KIND_MACHINE_DEPLOYMENT);
    }

    public MachineDeployment(String namespace, String name, String uid) {
        this();
        getMetadata().setNamespace(namespace);
        getMetadata().setName(name);
        getMetadata().setUid(uid);
    }

    /**
     * Declared replica count; an unset count reads as zero.
     */
    @JsonIgnore
    public int getReplicas() {
        if (spec == null || spec.getReplicas() == null) {
            return 0;
        }
        return spec.getReplicas();
    }

    @Override
    public MachineDeployment deepCopy() {
        return ResourceCopier.deepCopy(this, MachineDeployment.class);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineDeploymentSpec {
        @JsonProperty("replicas")
        private Integer replicas;
    }
}
