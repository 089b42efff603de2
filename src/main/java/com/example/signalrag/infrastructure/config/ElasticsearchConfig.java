package com.example.signalrag.infrastructure.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.example.signalrag.infrastructure.search.ChunkStore;
import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ElasticsearchConfig {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchConfig.class);

    @Bean(destroyMethod = "close")
    public RestClient elasticRestClient(
            @Value("${signalrag.elasticsearch.url}") String url,
            @Value("${signalrag.elasticsearch.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${signalrag.elasticsearch.socket-timeout-ms}") int socketTimeoutMs
    ) {
        URI uri = URI.create(url);
        HttpHost host = new HttpHost(uri.getHost(), uri.getPort(), uri.getScheme());

        log.info("event=elasticsearch_client_config url={} connectTimeoutMs={} socketTimeoutMs={}",
                url, connectTimeoutMs, socketTimeoutMs);

        RestClientBuilder builder = RestClient.builder(host)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(connectTimeoutMs)
                        .setConnectionRequestTimeout(connectTimeoutMs)
                        .setSocketTimeout(socketTimeoutMs));

        return builder.build();
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(RestClient restClient) {
        ElasticsearchTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        return new ElasticsearchClient(transport);
    }

    /**
     * Fixed pool for the per-signal retrieval fan-out; one request uses at most three threads.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService hybridSearchExecutor(
            @Value("${signalrag.rag.retrieve.threads:0}") int configuredThreads
    ) {
        int threads = configuredThreads > 0
                ? configuredThreads
                : Math.max(4, Runtime.getRuntime().availableProcessors());
        log.info("event=hybrid_executor_config threads={}", threads);
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public ApplicationRunner chunkIndexInitializer(ChunkStore store) {
        return args -> {
            try {
                store.ensureIndexExists();
            } catch (RuntimeException e) {
                // retried lazily on the first index or search call
                log.warn("event=index_init_failed err={}", e.toString());
            }
        };
    }
}
