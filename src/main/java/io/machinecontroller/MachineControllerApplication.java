package io.machinecontroller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.Client;
import io.machinecontroller.config.MachineControllerConfig;
import io.machinecontroller.correlation.NodeMachineCorrelator;
import io.machinecontroller.metrics.MetricsProvider;
import io.machinecontroller.nodegroup.NodeGroupDirectory;
import io.machinecontroller.nodegroup.ReplicaScaler;
import io.machinecontroller.nodegroup.ScalingBoundsValidator;
import io.machinecontroller.ownership.OwnerChainResolver;
import io.machinecontroller.store.EtcdPathResolver;
import io.machinecontroller.store.EtcdReplicaScaler;
import io.machinecontroller.store.EtcdResourceSynchronizer;
import io.machinecontroller.store.ResourceCaches;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Main Spring Boot application class for the Machine Controller.
 *
 * Keeps Node, Machine, MachineSet and MachineDeployment caches synchronized from etcd
 * and exposes the node groups derived from them to the capacity manager over REST.
 */
@Slf4j
@SpringBootApplication
public class MachineControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Machine Controller Application");

        try {
            SpringApplication.run(MachineControllerApplication.class, args);
            log.info("Machine Controller started successfully");
        } catch (Exception e) {
            log.error("Failed to start Machine Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public MachineControllerConfig config() {
        MachineControllerConfig config = new MachineControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "close")
    public Client etcdClient(MachineControllerConfig config) {
        log.info("Initializing etcd client for endpoints: {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public ResourceCaches resourceCaches() {
        return new ResourceCaches();
    }

    /**
     * Synchronizer bean. Startup blocks until every cache holds its initial list, so the
     * REST surface never answers from an empty cache.
     */
    @Bean
    public EtcdResourceSynchronizer resourceSynchronizer(Client etcdClient,
                                                         ObjectMapper objectMapper,
                                                         ResourceCaches resourceCaches,
                                                         MetricsProvider metricsProvider,
                                                         MachineControllerConfig config) {
        log.info("Initializing EtcdResourceSynchronizer for cluster: {}", config.getClusterName());
        EtcdResourceSynchronizer synchronizer = new EtcdResourceSynchronizer(
            etcdClient,
            EtcdPathResolver.getInstance(),
            objectMapper,
            resourceCaches,
            metricsProvider,
            config.getClusterName(),
            config.getSyncRetryDelaySeconds()
        );
        try {
            synchronizer.start();
        } catch (Exception e) {
            log.error("Failed to start resource synchronization: {}", e.getMessage(), e);
            throw new RuntimeException("Resource synchronization failed to start", e);
        }
        return synchronizer;
    }

    @Bean
    public OwnerChainResolver ownerChainResolver(ResourceCaches resourceCaches) {
        log.info("Initializing OwnerChainResolver");
        return new OwnerChainResolver(resourceCaches.getMachineSets(), resourceCaches.getMachineDeployments());
    }

    @Bean
    public NodeMachineCorrelator nodeMachineCorrelator(ResourceCaches resourceCaches) {
        log.info("Initializing NodeMachineCorrelator");
        return new NodeMachineCorrelator(resourceCaches.getNodes(), resourceCaches.getMachines());
    }

    @Bean
    public ReplicaScaler replicaScaler(Client etcdClient,
                                       ObjectMapper objectMapper,
                                       MetricsProvider metricsProvider,
                                       MachineControllerConfig config) {
        log.info("Initializing EtcdReplicaScaler");
        return new EtcdReplicaScaler(
            etcdClient, EtcdPathResolver.getInstance(), objectMapper, metricsProvider, config.getClusterName());
    }

    /**
     * NodeGroupDirectory bean. Depends on the synchronizer so discovery starts from
     * populated caches.
     */
    @Bean
    public NodeGroupDirectory nodeGroupDirectory(ResourceCaches resourceCaches,
                                                 EtcdResourceSynchronizer resourceSynchronizer,
                                                 OwnerChainResolver ownerChainResolver,
                                                 NodeMachineCorrelator nodeMachineCorrelator,
                                                 ReplicaScaler replicaScaler,
                                                 MetricsProvider metricsProvider) {
        log.info("Initializing NodeGroupDirectory (caches running: {})", resourceSynchronizer.isRunning());
        return new NodeGroupDirectory(
            resourceCaches.getMachines(),
            resourceCaches.getMachineSets(),
            resourceCaches.getMachineDeployments(),
            ownerChainResolver,
            nodeMachineCorrelator,
            new ScalingBoundsValidator(),
            replicaScaler,
            metricsProvider
        );
    }
}
