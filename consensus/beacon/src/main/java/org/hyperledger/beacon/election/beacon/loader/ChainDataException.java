package org.hyperledger.beacon.election.beacon.loader;

/** Thrown when chain data (validators, committees, blocks) is missing or malformed. */
public class ChainDataException extends RuntimeException {

  public ChainDataException(final String message) {
    super(message);
  }

  public ChainDataException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
