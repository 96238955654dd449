package org.paycron.nodes;

public record NodeInfo(String alias, String identityPubkey, boolean syncedToChain) {}
