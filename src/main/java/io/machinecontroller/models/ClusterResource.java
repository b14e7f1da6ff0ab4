package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.machinecontroller.util.ResourceCopier;
import lombok.Data;

/**
 * Common shape of every synchronized resource: a kind and its metadata.
 *
 * Instances handed out by a cache are shared with the cache; call {@link #deepCopy()}
 * before changing any field.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class ClusterResource {

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("metadata")
    private ObjectMeta metadata = new ObjectMeta();

    protected ClusterResource(String kind) {
        this.kind = kind;
    }

    @JsonIgnore
    public String getName() {
        return metadata == null ? null : metadata.getName();
    }

    @JsonIgnore
    public String getNamespace() {
        return metadata == null ? null : metadata.getNamespace();
    }

    @JsonIgnore
    public String getUid() {
        return metadata == null ? null : metadata.getUid();
    }

    /**
     * Independently owned copy of this resource, including nested maps and lists.
     */
    public ClusterResource deepCopy() {
        return ResourceCopier.deepCopy(this, getClass());
    }
}
