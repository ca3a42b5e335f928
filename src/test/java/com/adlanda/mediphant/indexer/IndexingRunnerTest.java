package com.adlanda.mediphant.indexer;

import com.adlanda.mediphant.config.ExternalClientFactory;
import com.adlanda.mediphant.model.CredentialStatus;
import com.adlanda.mediphant.model.ExternalServicesSettings;
import com.adlanda.mediphant.service.CorpusChunker;
import com.adlanda.mediphant.service.CorpusSource;
import com.adlanda.mediphant.service.EmbeddingService;
import com.adlanda.mediphant.support.InMemoryVectorIndex;
import com.adlanda.mediphant.support.TestCorpus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexingRunnerTest {

    private static final ExternalServicesSettings ALL_PRESENT =
            new ExternalServicesSettings(CredentialStatus.PRESENT, CredentialStatus.PRESENT);

    @Mock
    private ExternalClientFactory clientFactory;

    @Mock
    private CorpusSource corpusSource;

    @Mock
    private EmbeddingService embeddingService;

    @Test
    void run_unknownCommand_exitsWithUsageCode() {
        IndexingRunner runner = runner("reindex");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(IndexingRunner.EXIT_USAGE);
        verifyNoInteractions(clientFactory);
    }

    @Test
    void run_missingCredentials_exitsWithFailure() {
        when(clientFactory.settings())
                .thenReturn(new ExternalServicesSettings(CredentialStatus.PRESENT, CredentialStatus.ABSENT));
        IndexingRunner runner = runner("test");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(IndexingRunner.EXIT_FAILURE);
        verify(clientFactory, never()).createVectorIndex();
    }

    @Test
    void run_test_checksConnection() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
        when(clientFactory.settings()).thenReturn(ALL_PRESENT);
        when(clientFactory.createEmbeddingService()).thenReturn(embeddingService);
        when(clientFactory.createVectorIndex()).thenReturn(vectorIndex);
        IndexingRunner runner = runner("TEST");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        verifyNoInteractions(corpusSource);
    }

    @Test
    void run_test_unreachableIndex_exitsWithFailure() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
        vectorIndex.setFailing(true);
        when(clientFactory.settings()).thenReturn(ALL_PRESENT);
        when(clientFactory.createEmbeddingService()).thenReturn(embeddingService);
        when(clientFactory.createVectorIndex()).thenReturn(vectorIndex);
        IndexingRunner runner = runner("test");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(IndexingRunner.EXIT_FAILURE);
    }

    @Test
    void run_index_loadsCorpusIntoIndex() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
        when(clientFactory.settings()).thenReturn(ALL_PRESENT);
        when(clientFactory.createEmbeddingService()).thenReturn(embeddingService);
        when(clientFactory.createVectorIndex()).thenReturn(vectorIndex);
        when(corpusSource.read()).thenReturn(new CorpusSource.Document("corpus.md", TestCorpus.DOCUMENT));
        when(embeddingService.embedAll(anyList())).thenAnswer(invocation ->
                Collections.nCopies(((List<?>) invocation.getArgument(0)).size(), new float[]{1f, 0f}));
        IndexingRunner runner = runner("index");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(vectorIndex.size()).isEqualTo(5);
    }

    private IndexingRunner runner(String command) {
        return new IndexingRunner(clientFactory, new CorpusChunker(), corpusSource, command);
    }
}
