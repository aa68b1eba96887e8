package com.venuelink.adapter.core.signing;

@FunctionalInterface
public interface RequestSigner {
  SignedRequest sign(SigningRequest request);
}
