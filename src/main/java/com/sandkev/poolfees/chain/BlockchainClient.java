package com.sandkev.poolfees.chain;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Block-indexing API as seen by the reconciliation engine.
 * Implementations never throw for upstream problems: a failed or malformed call is an empty result.
 */
public interface BlockchainClient {

    /** Number of the latest block mined at or before now. */
    OptionalLong latestBlock();

    /**
     * Pool transactions with {@code fromBlock <= blockNumber [<= toBlock]}, ascending, one page.
     * An upstream "no transactions" reply is an empty list, not an empty Optional.
     */
    Optional<List<ChainTransaction>> historicalTransactions(long fromBlock, @Nullable Long toBlock);

    /** Maximum number of transactions a single {@link #historicalTransactions} call returns. */
    int pageSize();
}
