package com.sandkev.poolfees.chain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Etherscan envelope: {"status":"1","message":"OK","result":...}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EtherscanResponse<T>(String status, String message, T result) {}
