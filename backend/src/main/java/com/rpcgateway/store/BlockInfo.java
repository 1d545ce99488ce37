package com.rpcgateway.store;

/**
 * A block of an epoch: its number and hash.
 */
public record BlockInfo(long blockNumber, String hash) {}
