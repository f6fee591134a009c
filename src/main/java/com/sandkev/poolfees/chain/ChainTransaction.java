package com.sandkev.poolfees.chain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the tokentx listing. Gas fields stay raw strings; they are validated when the fee is computed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainTransaction(
        String hash,
        String gasPrice,     // wei
        String gasUsed,
        long   blockNumber,
        @JsonProperty("timeStamp") long timestamp   // epoch seconds
) {}
