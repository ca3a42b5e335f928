package com.adlanda.mediphant.indexer;

import com.adlanda.mediphant.config.ExternalClientFactory;
import com.adlanda.mediphant.model.CredentialStatus;
import com.adlanda.mediphant.model.ExternalServicesSettings;
import com.adlanda.mediphant.service.CorpusChunker;
import com.adlanda.mediphant.service.CorpusSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs the offline indexer command given in {@code faq.indexer.command}.
 *
 * Exit codes: 0 on success, 1 when the command fails, 2 for an unknown command.
 */
@Component
@ConditionalOnProperty(prefix = "faq.indexer", name = "command")
public class IndexingRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(IndexingRunner.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ExternalClientFactory clientFactory;
    private final CorpusChunker chunker;
    private final CorpusSource corpusSource;
    private final String command;

    private int exitCode;

    public IndexingRunner(ExternalClientFactory clientFactory, CorpusChunker chunker, CorpusSource corpusSource,
                          @Value("${faq.indexer.command}") String command) {
        this.clientFactory = clientFactory;
        this.chunker = chunker;
        this.corpusSource = corpusSource;
        this.command = command;
    }

    @Override
    public void run(ApplicationArguments args) {
        Optional<IndexerCommand> parsed = IndexerCommand.parse(command);
        if (parsed.isEmpty()) {
            log.error("""
                    Unknown indexer command '{}'. Usage:
                      IndexerApplication test    # Test vector index connection
                      IndexerApplication index   # Index the corpus""", command);
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            CorpusIndexer indexer = createIndexer();
            switch (parsed.get()) {
                case TEST -> indexer.testConnection();
                case INDEX -> {
                    CorpusSource.Document document = corpusSource.read();
                    indexer.indexCorpus(document.content(), document.sourceRef());
                }
            }
            exitCode = 0;
        } catch (Exception e) {
            log.error("Indexer command '{}' failed: {}", command, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private CorpusIndexer createIndexer() {
        ExternalServicesSettings settings = clientFactory.settings();
        if (settings.embeddingCredential() == CredentialStatus.ABSENT) {
            throw new IllegalStateException("OPENAI_API_KEY environment variable is required");
        }
        if (settings.vectorCredential() == CredentialStatus.ABSENT) {
            throw new IllegalStateException("PINECONE_API_KEY environment variable is required");
        }
        return new CorpusIndexer(chunker, clientFactory.createEmbeddingService(), clientFactory.createVectorIndex());
    }
}
