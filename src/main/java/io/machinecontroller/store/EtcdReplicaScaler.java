package io.machinecontroller.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.machinecontroller.enums.ResourceKind;
import io.machinecontroller.metrics.MetricsProvider;
import io.machinecontroller.nodegroup.ReplicaScaler;
import io.machinecontroller.nodegroup.ReplicaUpdateException;
import io.machinecontroller.nodegroup.ScalableResource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.machinecontroller.metrics.MetricsConstants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes the declared replica count of a MachineSet or MachineDeployment back to etcd.
 *
 * The stored document is read, patched in place (only spec.replicas changes, unknown
 * fields survive) and written with a compare-and-swap on the key's mod revision. The
 * cache picks the change up through the synchronizer's watch.
 */
@Slf4j
public class EtcdReplicaScaler implements ReplicaScaler {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final MetricsProvider metricsProvider;
    private final String clusterName;

    public EtcdReplicaScaler(Client etcdClient,
                             EtcdPathResolver pathResolver,
                             ObjectMapper objectMapper,
                             MetricsProvider metricsProvider,
                             String clusterName) {
        this.kvClient = etcdClient.getKVClient();
        this.pathResolver = pathResolver;
        this.objectMapper = objectMapper;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
    }

    @Override
    public void setReplicas(ScalableResource resource, int replicas) throws ReplicaUpdateException {
        ResourceKind kind = resource.getKind().getResourceKind();
        String key = pathResolver.getResourcePath(clusterName, kind, resource.getNamespace(), resource.getName());
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);

        try {
            GetResponse getResponse = kvClient.get(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (getResponse.getKvs().isEmpty()) {
                throw new ReplicaUpdateException("Cannot resize " + resource + ": no document at " + key);
            }

            KeyValue current = getResponse.getKvs().get(0);
            String updated = withReplicas(current.getValue().toString(UTF_8), replicas);
            ByteSequence valueBytes = ByteSequence.from(updated, UTF_8);

            TxnResponse txnResponse = kvClient.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(current.getModRevision())))
                .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                .Else(Op.get(keyBytes, GetOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (!txnResponse.isSucceeded()) {
                throw new ReplicaUpdateException("Failed to resize " + resource
                    + " due to concurrent modification. Please retry.");
            }
        } catch (ReplicaUpdateException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplicaUpdateException("Interrupted while resizing " + resource, e);
        } catch (Exception e) {
            throw new ReplicaUpdateException("Failed to resize " + resource + ": " + e.getMessage(), e);
        }

        metricsProvider.counter(NODE_GROUP_RESIZE_METRIC_NAME, Map.of(
            KIND_TAG, kind.getKind(),
            NODE_GROUP_TAG, resource.getNamespace() + "/" + resource.getName()
        )).increment();
        log.info("Set replicas of {} to {}", resource, replicas);
    }

    /**
     * Set spec.replicas in a stored document, leaving every other field untouched.
     */
    String withReplicas(String document, int replicas) throws IOException {
        JsonNode root = objectMapper.readTree(document);
        if (!(root instanceof ObjectNode)) {
            throw new IOException("Stored document is not a JSON object");
        }
        ObjectNode object = (ObjectNode) root;
        JsonNode spec = object.get("spec");
        ObjectNode specObject = spec instanceof ObjectNode ? (ObjectNode) spec : object.putObject("spec");
        specObject.put("replicas", replicas);
        return objectMapper.writeValueAsString(object);
    }
}
