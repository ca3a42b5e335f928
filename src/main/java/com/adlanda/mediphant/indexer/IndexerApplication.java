package com.adlanda.mediphant.indexer;

import com.adlanda.mediphant.MediphantApplication;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Command-line entry point of the offline indexer.
 *
 * <pre>
 *   IndexerApplication test    # Test vector index connection
 *   IndexerApplication index   # Index the corpus
 * </pre>
 */
public final class IndexerApplication {

    private IndexerApplication() {
    }

    public static void main(String[] args) {
        String command = args.length > 0 ? args[0] : "";
        ConfigurableApplicationContext context = new SpringApplicationBuilder(MediphantApplication.class)
                .web(WebApplicationType.NONE)
                .properties("faq.indexer.command=" + command)
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}
