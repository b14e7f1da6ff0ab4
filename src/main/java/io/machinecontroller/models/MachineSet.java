package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.machinecontroller.util.ResourceCopier;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import static io.machinecontroller.config.Constants.KIND_MACHINE_SET;

/**
 * Scalable group descriptor owning Machines whose owner reference matches its name, kind and uid.
 * May itself be owned by a MachineDeployment.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineSet extends ClusterResource {

    @JsonProperty("spec")
    private MachineSetSpec spec = new MachineSetSpec();

    public MachineSet() {
        super(KIND_MACHINE_SET);
    }

    public MachineSet(String namespace, String name, String uid) {
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
    public MachineSet deepCopy() {
        return ResourceCopier.deepCopy(this, MachineSet.class);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineSetSpec {
        @JsonProperty("replicas")
        private Integer replicas;
    }
}
