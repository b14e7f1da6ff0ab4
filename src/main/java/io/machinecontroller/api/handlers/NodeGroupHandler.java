package io.machinecontroller.api.handlers;

import io.machinecontroller.api.models.requests.ResizeRequest;
import io.machinecontroller.api.models.responses.ErrorResponse;
import io.machinecontroller.api.models.responses.NodeGroupListResponse;
import io.machinecontroller.api.models.responses.NodeGroupMembersResponse;
import io.machinecontroller.api.models.responses.NodeGroupResponse;
import io.machinecontroller.api.models.responses.ResizeResponse;
import io.machinecontroller.correlation.NodeMachineCorrelator;
import io.machinecontroller.enums.NodeGroupKind;
import io.machinecontroller.models.Node;
import io.machinecontroller.nodegroup.NodeGroup;
import io.machinecontroller.nodegroup.NodeGroupConfigurationException;
import io.machinecontroller.nodegroup.NodeGroupDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST API handler for node group discovery and resizing, used by the capacity manager.
 *
 * Supported operations:
 * - GET /_nodegroups - All scalable node groups
 * - GET /_nodegroups/{kind}/{namespace}/{name} - One node group
 * - GET /_nodegroups/{kind}/{namespace}/{name}/_nodes - Nodes linked to a node group
 * - PUT /_nodegroups/{kind}/{namespace}/{name}/_size - Resize a node group
 * - GET /_nodes/{nodeName}/_nodegroup - Node group a node belongs to
 *
 * {kind} is MachineSet or MachineDeployment, case-insensitive.
 */
@Slf4j
@RestController
public class NodeGroupHandler {

    private final NodeGroupDirectory nodeGroupDirectory;
    private final NodeMachineCorrelator nodeMachineCorrelator;

    public NodeGroupHandler(NodeGroupDirectory nodeGroupDirectory, NodeMachineCorrelator nodeMachineCorrelator) {
        this.nodeGroupDirectory = nodeGroupDirectory;
        this.nodeMachineCorrelator = nodeMachineCorrelator;
    }

    /**
     * List all node groups.
     * GET /_nodegroups
     */
    @GetMapping("/_nodegroups")
    public ResponseEntity<Object> listNodeGroups() {
        try {
            List<NodeGroupResponse> nodeGroups = nodeGroupDirectory.listNodeGroups().stream()
                .map(NodeGroupResponse::from)
                .toList();
            return ResponseEntity.ok(NodeGroupListResponse.builder()
                .total(nodeGroups.size())
                .nodeGroups(nodeGroups)
                .build());
        } catch (NodeGroupConfigurationException e) {
            log.error("Node group configuration error: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.configurationError(e.getMessage()));
        } catch (Exception e) {
            log.error("Error listing node groups: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Get one node group.
     * GET /_nodegroups/{kind}/{namespace}/{name}
     */
    @GetMapping("/_nodegroups/{kind}/{namespace}/{name}")
    public ResponseEntity<Object> getNodeGroup(
            @PathVariable String kind,
            @PathVariable String namespace,
            @PathVariable String name) {
        try {
            Optional<NodeGroup> nodeGroup = findNodeGroup(kind, namespace, name);
            if (nodeGroup.isEmpty()) {
                return notFound(kind, namespace, name);
            }
            return ResponseEntity.ok(NodeGroupResponse.from(nodeGroup.get()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid node group request {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (NodeGroupConfigurationException e) {
            log.error("Node group {} {}/{} is misconfigured: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.configurationError(e.getMessage()));
        } catch (Exception e) {
            log.error("Error getting node group {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Get the nodes of a node group.
     * GET /_nodegroups/{kind}/{namespace}/{name}/_nodes
     */
    @GetMapping("/_nodegroups/{kind}/{namespace}/{name}/_nodes")
    public ResponseEntity<Object> getNodeGroupNodes(
            @PathVariable String kind,
            @PathVariable String namespace,
            @PathVariable String name) {
        try {
            Optional<NodeGroup> nodeGroup = findNodeGroup(kind, namespace, name);
            if (nodeGroup.isEmpty()) {
                return notFound(kind, namespace, name);
            }
            NodeGroup group = nodeGroup.get();
            return ResponseEntity.ok(NodeGroupMembersResponse.builder()
                .id(group.id())
                .kind(group.kind().getKind())
                .targetSize(group.size())
                .nodes(group.members())
                .build());
        } catch (IllegalArgumentException e) {
            log.error("Invalid node group request {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (NodeGroupConfigurationException e) {
            log.error("Node group {} {}/{} is misconfigured: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.configurationError(e.getMessage()));
        } catch (Exception e) {
            log.error("Error getting nodes of node group {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Resize a node group, either to an absolute size or by a delta.
     * PUT /_nodegroups/{kind}/{namespace}/{name}/_size
     */
    @PutMapping("/_nodegroups/{kind}/{namespace}/{name}/_size")
    public ResponseEntity<Object> resizeNodeGroup(
            @PathVariable String kind,
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestBody ResizeRequest request) {
        try {
            if (request == null || (request.getSize() == null) == (request.getDelta() == null)) {
                throw new IllegalArgumentException("Exactly one of 'size' or 'delta' must be provided");
            }

            Optional<NodeGroup> nodeGroup = findNodeGroup(kind, namespace, name);
            if (nodeGroup.isEmpty()) {
                return notFound(kind, namespace, name);
            }

            NodeGroup group = nodeGroup.get();
            int previousSize = group.size();
            int targetSize;
            if (request.getSize() != null) {
                targetSize = request.getSize();
                log.info("Setting size of node group {} {} to {}", kind, group.id(), targetSize);
                group.setSize(targetSize);
            } else if (request.getDelta() > 0) {
                targetSize = previousSize + request.getDelta();
                log.info("Increasing size of node group {} {} by {}", kind, group.id(), request.getDelta());
                group.increaseSize(request.getDelta());
            } else {
                targetSize = previousSize + request.getDelta();
                log.info("Decreasing target size of node group {} {} by {}", kind, group.id(), -request.getDelta());
                group.decreaseTargetSize(request.getDelta());
            }

            return ResponseEntity.ok(ResizeResponse.builder()
                .acknowledged(true)
                .id(group.id())
                .kind(group.kind().getKind())
                .previousSize(previousSize)
                .targetSize(targetSize)
                .build());
        } catch (IllegalArgumentException e) {
            log.error("Invalid resize request for node group {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (NodeGroupConfigurationException e) {
            log.error("Node group {} {}/{} is misconfigured: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.configurationError(e.getMessage()));
        } catch (Exception e) {
            log.error("Error resizing node group {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Get the node group a node belongs to.
     * GET /_nodes/{nodeName}/_nodegroup
     */
    @GetMapping("/_nodes/{nodeName}/_nodegroup")
    public ResponseEntity<Object> getNodeGroupForNode(@PathVariable String nodeName) {
        try {
            Optional<Node> node = nodeMachineCorrelator.findNodeByName(nodeName);
            if (node.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Node [" + nodeName + "]"));
            }

            Optional<NodeGroup> nodeGroup = nodeGroupDirectory.nodeGroupForNode(node.get());
            if (nodeGroup.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.notFound("Node group for node [" + nodeName + "]"));
            }
            return ResponseEntity.ok(NodeGroupResponse.from(nodeGroup.get()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid node group lookup for node '{}': {}", nodeName, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error getting node group for node '{}': {}", nodeName, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    private Optional<NodeGroup> findNodeGroup(String kind, String namespace, String name)
            throws NodeGroupConfigurationException {
        NodeGroupKind nodeGroupKind = NodeGroupKind.fromKind(kind);
        if (nodeGroupKind == null) {
            throw new IllegalArgumentException("Unknown node group kind [" + kind + "], expected "
                + NodeGroupKind.MACHINE_SET.getKind() + " or " + NodeGroupKind.MACHINE_DEPLOYMENT.getKind());
        }
        return nodeGroupDirectory.nodeGroupById(nodeGroupKind, namespace, name);
    }

    private ResponseEntity<Object> notFound(String kind, String namespace, String name) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.notFound("Node group [" + kind + " " + namespace + "/" + name + "]"));
    }
}
