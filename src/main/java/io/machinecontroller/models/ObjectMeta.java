package io.machinecontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata shared by every resource kind.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ObjectMeta {

    @JsonProperty("name")
    private String name;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("uid")
    private String uid;

    @JsonProperty("labels")
    private Map<String, String> labels = new HashMap<>();

    @JsonProperty("annotations")
    private Map<String, String> annotations = new HashMap<>();

    @JsonProperty("ownerReferences")
    private List<OwnerReference> ownerReferences = new ArrayList<>();

    public ObjectMeta() {
    }

    public ObjectMeta(String namespace, String name, String uid) {
        this.namespace = namespace;
        this.name = name;
        this.uid = uid;
    }

    /**
     * @return the annotation value, or null if the annotation is not set
     */
    public String getAnnotation(String key) {
        return annotations == null ? null : annotations.get(key);
    }

    public Map<String, String> annotationsOrEmpty() {
        return annotations == null ? Map.of() : annotations;
    }

    public Map<String, String> labelsOrEmpty() {
        return labels == null ? Map.of() : labels;
    }

    public List<OwnerReference> ownerReferencesOrEmpty() {
        return ownerReferences == null ? List.of() : ownerReferences;
    }
}
