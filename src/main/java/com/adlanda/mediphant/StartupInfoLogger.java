package com.adlanda.mediphant;

import com.adlanda.mediphant.service.CorpusSnapshot;
import com.adlanda.mediphant.service.SearchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnWebApplication
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final CorpusSnapshot corpus;
    private final SearchOrchestrator orchestrator;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(CorpusSnapshot corpus, SearchOrchestrator orchestrator) {
        this.corpus = corpus;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Mediphant FAQ v{}
            Corpus: {} chunks from {}
            Search mode: {}

            API Endpoints:
              GET    http://localhost:{}/api/faq?q=...
              GET    http://localhost:{}/api/history
              POST   http://localhost:{}/api/history
              DELETE http://localhost:{}/api/history

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, corpus.size(), corpus.sourceRef(), orchestrator.mode(), port, port, port, port, port
        );
    }
}
