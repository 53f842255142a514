package org.hyperledger.beacon.election.beacon.helpers;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.LightState;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.RandaoMixes;
import org.hyperledger.beacon.election.beacon.types.DomainType;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.config.ChainConfig;

/** Derivation of the per-epoch, per-domain seeds from the RANDAO mix ring. */
public final class Seeds {

  private Seeds() {}

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#get_seed
  public static Bytes32 computeSeed(
      final LightState state, final Epoch epoch, final DomainType domain) {
    return computeSeed(state.config(), state.randaoMixes(), epoch, domain);
  }

  /**
   * Computes {@code sha256(domain ‖ uint64(epoch) ‖ mix)} where {@code mix} is the ring entry at
   * {@link #seedRingPosition(ChainConfig, Epoch)}.
   *
   * @param config chain constants
   * @param mixes the RANDAO mix ring
   * @param epoch the epoch the seed is for
   * @param domain the domain separating this seed from the others of the same epoch
   * @return the seed
   */
  public static Bytes32 computeSeed(
      final ChainConfig config,
      final RandaoMixes mixes,
      final Epoch epoch,
      final DomainType domain) {
    final Bytes32 mix = mixes.getAt(seedRingPosition(config, epoch));
    return Hashing.sha256(domain.tag(), Serialization.uint64(epoch.value().value()), mix);
  }

  /**
   * The ring position read when deriving seeds for {@code epoch}, i.e. the position of epoch
   * {@code epoch + EPOCHS_PER_HISTORICAL_VECTOR - MIN_SEED_LOOKAHEAD - 1}.
   *
   * @param config chain constants
   * @param epoch the epoch the seed is for
   * @return the ring position
   */
  public static int seedRingPosition(final ChainConfig config, final Epoch epoch) {
    final long length = config.epochsPerHistoricalVector();
    final long offset = epoch.value().mod(length).value();
    return (int) ((offset + length - config.minSeedLookahead() - 1) % length);
  }
}
