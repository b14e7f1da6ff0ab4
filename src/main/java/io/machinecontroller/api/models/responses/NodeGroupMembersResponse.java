package io.machinecontroller.api.models.responses;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.machinecontroller.models.NodeInstance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Nodes currently linked to a node group. {@code targetSize} is the declared replica
 * count and may differ from the number of nodes while machines are provisioning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeGroupMembersResponse {
    private String id;
    private String kind;
    private int targetSize;
    private List<NodeInstance> nodes;
}
