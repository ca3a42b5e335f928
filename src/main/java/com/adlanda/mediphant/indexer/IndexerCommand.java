package com.adlanda.mediphant.indexer;

import java.util.Locale;
import java.util.Optional;

public enum IndexerCommand {

    /** Verify connectivity to the vector index. */
    TEST,

    /** Chunk, embed and upsert the corpus. */
    INDEX;

    public static Optional<IndexerCommand> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (IndexerCommand command : values()) {
            if (command.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
