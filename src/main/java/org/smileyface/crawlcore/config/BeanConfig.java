package org.smileyface.crawlcore.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.checkpoint.InMemoryRunStore;
import org.smileyface.crawlcore.checkpoint.JdbcRunStore;
import org.smileyface.crawlcore.checkpoint.RunStore;
import org.smileyface.crawlcore.frontier.CrawlFrontier;
import org.smileyface.crawlcore.frontier.FrontierPolicy;
import org.smileyface.crawlcore.frontier.InMemoryCrawlFrontier;
import org.smileyface.crawlcore.frontier.RedisCrawlFrontier;
import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.proxy.InMemoryProxyPool;
import org.smileyface.crawlcore.proxy.JdbcProxyPool;
import org.smileyface.crawlcore.proxy.ProxyPool;
import org.smileyface.crawlcore.queue.InMemoryWorkQueue;
import org.smileyface.crawlcore.queue.JdbcWorkQueue;
import org.smileyface.crawlcore.queue.WorkQueue;
import org.smileyface.crawlcore.resource.InMemoryResourceTracker;
import org.smileyface.crawlcore.resource.JdbcResourceTracker;
import org.smileyface.crawlcore.resource.OsProcessManager;
import org.smileyface.crawlcore.resource.ProcessManager;
import org.smileyface.crawlcore.resource.ResourceTracker;
import org.smileyface.crawlcore.worker.HeartbeatScheduler;
import org.smileyface.crawlcore.worker.WorkerServices;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wires the coordination components. {@code orchestrator.store.type} selects the in-memory or
 * JDBC implementation of the run store, work queue, proxy pool and resource tracker;
 * {@code orchestrator.frontier.type} selects the in-memory or Redis frontier.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RunStore runStore(OrchestratorProperties properties,
                             ObjectProvider<JdbcTemplate> jdbc,
                             ObjectProvider<TransactionTemplate> tx) {
        if (isJdbc(properties)) {
            return new JdbcRunStore(requireJdbc(jdbc), requireTx(tx));
        }
        return new InMemoryRunStore();
    }

    @Bean
    public CheckpointManager checkpointManager(RunStore runStore, Clock clock) {
        return new CheckpointManager(runStore, clock);
    }

    @Bean
    public WorkQueue workQueue(OrchestratorProperties properties, Clock clock,
                               ObjectProvider<JdbcTemplate> jdbc,
                               ObjectProvider<TransactionTemplate> tx) {
        OrchestratorProperties.Queue q = properties.getQueue();
        if (isJdbc(properties)) {
            return new JdbcWorkQueue(requireJdbc(jdbc), requireTx(tx), clock, q.getMaxAttempts(), q.getHeartbeatExpiry());
        }
        return new InMemoryWorkQueue(clock, q.getMaxAttempts(), q.getHeartbeatExpiry());
    }

    /**
     * "redis" uses {@link RedisCrawlFrontier} when a {@link StringRedisTemplate} is available and
     * falls back to {@link InMemoryCrawlFrontier} otherwise.
     */
    @Bean
    public CrawlFrontier crawlFrontier(ObjectProvider<StringRedisTemplate> redisProvider,
                                       OrchestratorProperties properties, Clock clock) {
        FrontierPolicy defaults = properties.resolve(null).frontier();
        if ("redis".equals(properties.normalizedFrontierType())) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                return new RedisCrawlFrontier(template, clock, properties.getFrontier().getNamespace(),
                        defaults, properties.getFrontier().getScanLimit());
            }
            log.warn("orchestrator.frontier.type=redis but no Redis connection is configured, using the in-memory frontier");
        }
        return new InMemoryCrawlFrontier(clock, defaults);
    }

    @Bean
    public ProxyPool proxyPool(OrchestratorProperties properties, Clock clock,
                               ObjectProvider<JdbcTemplate> jdbc,
                               ObjectProvider<TransactionTemplate> tx) {
        ProxyPool pool = isJdbc(properties)
                ? new JdbcProxyPool(requireJdbc(jdbc), requireTx(tx), clock, properties.proxyHealthPolicy())
                : new InMemoryProxyPool(clock, properties.proxyHealthPolicy());
        for (OrchestratorProperties.ProxyEndpointConfig c : properties.getProxy().getEndpoints()) {
            ProxyEndpoint e = new ProxyEndpoint(c.getId(), c.getAddress(), c.getCountryCode(), c.getType());
            e.setUsername(c.getUsername());
            e.setPassword(c.getPassword());
            pool.register(e);
        }
        log.info("Proxy pool ready with {} configured endpoints", properties.getProxy().getEndpoints().size());
        return pool;
    }

    @Bean
    public ResourceTracker resourceTracker(OrchestratorProperties properties, Clock clock,
                                           ObjectProvider<JdbcTemplate> jdbc) {
        if (isJdbc(properties)) {
            return new JdbcResourceTracker(requireJdbc(jdbc), clock);
        }
        return new InMemoryResourceTracker(clock);
    }

    @Bean
    public ProcessManager processManager() {
        return new OsProcessManager();
    }

    @Bean(destroyMethod = "shutdown")
    public HeartbeatScheduler heartbeatScheduler(OrchestratorProperties properties) {
        return new HeartbeatScheduler(Math.max(2, properties.getWorkers().getCount()));
    }

    @Bean
    public WorkerServices workerServices(WorkQueue queue, CrawlFrontier frontier, ProxyPool proxies,
                                         ResourceTracker resources, CheckpointManager checkpoints,
                                         HeartbeatScheduler heartbeats, Clock clock) {
        return new WorkerServices(queue, frontier, proxies, resources, checkpoints, heartbeats, clock);
    }

    private static boolean isJdbc(OrchestratorProperties properties) {
        return "jdbc".equals(properties.normalizedStoreType());
    }

    private static JdbcTemplate requireJdbc(ObjectProvider<JdbcTemplate> jdbc) {
        JdbcTemplate template = jdbc.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("orchestrator.store.type=jdbc but no JdbcTemplate is available");
        }
        return template;
    }

    private static TransactionTemplate requireTx(ObjectProvider<TransactionTemplate> tx) {
        TransactionTemplate template = tx.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("orchestrator.store.type=jdbc but no TransactionTemplate is available");
        }
        return template;
    }
}
