package io.machinecontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.machinecontroller.nodegroup.NodeGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One node group as seen by the capacity manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeGroupResponse {
    private String id;
    private String kind;
    private String namespace;
    private String name;
    private int minSize;
    private int maxSize;
    private int targetSize;

    public static NodeGroupResponse from(NodeGroup nodeGroup) {
        return NodeGroupResponse.builder()
            .id(nodeGroup.id())
            .kind(nodeGroup.kind().getKind())
            .namespace(nodeGroup.namespace())
            .name(nodeGroup.name())
            .minSize(nodeGroup.minSize())
            .maxSize(nodeGroup.maxSize())
            .targetSize(nodeGroup.size())
            .build();
    }
}
