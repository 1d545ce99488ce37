package com.rpcgateway.store;

/** Inclusive block number range. */
public record BlockRange(long from, long to) {}
