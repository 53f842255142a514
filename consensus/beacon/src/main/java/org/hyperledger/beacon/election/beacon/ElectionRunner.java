package org.hyperledger.beacon.election.beacon;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hyperledger.beacon.election.beacon.committee.CommitteeCalculator;
import org.hyperledger.beacon.election.beacon.containers.beacon_blocks.LightBlock;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.LightState;
import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.helpers.ChainMath;
import org.hyperledger.beacon.election.beacon.loader.ChainDataException;
import org.hyperledger.beacon.election.beacon.loader.JsonCommitteeSource;
import org.hyperledger.beacon.election.beacon.loader.LightBlockLoader;
import org.hyperledger.beacon.election.beacon.loader.ValidatorRegistryLoader;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.UInt64;
import org.hyperledger.beacon.election.beacon.verification.ElectionVerifier;
import org.hyperledger.beacon.election.beacon.verification.VerificationResult;
import org.hyperledger.beacon.election.config.ChainConfig;
import org.hyperledger.beacon.election.config.ChainConfigException;

/**
 * Replays the committee elections of a range of epochs from a validator snapshot and checks them
 * against the committees the chain used.
 *
 * <p>The data directory holds {@code block-N.json}, a block of the epoch before epoch {@code N}
 * whose {@code prev_randao} seeds epoch {@code N} (required for the start epoch), and {@code
 * committees-N.json}, the committees of epoch {@code N}.
 */
public class ElectionRunner {

  private static final Logger LOG = LogManager.getLogger(ElectionRunner.class);

  static final int EXIT_PASSED = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE =
      "Usage: election-runner <epoch-start> <epoch-catchup> <validators-file> <data-dir>"
          + " [chain-config-file]\n"
          + "\t<epoch-start> is the first epoch to elect committees for\n"
          + "\t<epoch-catchup> is the last epoch to elect committees for\n"
          + "\t<validators-file> is the JSON validator registry snapshot\n"
          + "\t<data-dir> holds block-<epoch>.json and committees-<epoch>.json files\n"
          + "\t[chain-config-file] is a JSON chain config, mainnet when omitted";

  private final ChainConfig config;
  private final ElectionVerifier verifier;

  public ElectionRunner(final ChainConfig config) {
    this.config = config;
    this.verifier = new ElectionVerifier(new CommitteeCalculator(config));
  }

  public static void main(final String[] args) {
    System.exit(run(args));
  }

  static int run(final String[] args) {
    if (args.length < 4 || args.length > 5) {
      LOG.error(USAGE);
      return EXIT_USAGE;
    }
    final Epoch startEpoch;
    final Epoch catchupEpoch;
    try {
      startEpoch = Epoch.fromString(args[0]);
      catchupEpoch = Epoch.fromString(args[1]);
    } catch (NumberFormatException e) {
      LOG.error("Invalid epoch: {}\n{}", e.getMessage(), USAGE);
      return EXIT_USAGE;
    }
    if (catchupEpoch.isBefore(startEpoch)) {
      LOG.error("Catch-up epoch {} precedes start epoch {}", catchupEpoch, startEpoch);
      return EXIT_USAGE;
    }

    try {
      final ChainConfig config =
          args.length == 5 ? ChainConfig.fromFile(Path.of(args[4])) : ChainConfig.MAINNET;
      if (!hasSlots(config, catchupEpoch)) {
        LOG.error(
            "Epoch {} is beyond the last epoch with 64-bit slot numbers\n{}", catchupEpoch, USAGE);
        return EXIT_USAGE;
      }
      final List<Validator> validators = ValidatorRegistryLoader.load(Path.of(args[2]));
      final List<VerificationResult> results =
          new ElectionRunner(config)
              .runElections(validators, Path.of(args[3]), startEpoch, catchupEpoch);
      return results.stream().allMatch(VerificationResult::passed) ? EXIT_PASSED : EXIT_FAILED;
    } catch (ChainDataException | ChainConfigException e) {
      LOG.error("Election run aborted: {}", e.getMessage(), e);
      return EXIT_FAILED;
    }
  }

  /**
   * Runs the elections of every epoch from {@code startEpoch} to {@code catchupEpoch}, both
   * inclusive.
   *
   * @param validators the validator registry snapshot
   * @param dataDirectory directory holding the block and committee files
   * @param startEpoch first epoch
   * @param catchupEpoch last epoch
   * @return one result per epoch
   */
  public List<VerificationResult> runElections(
      final List<Validator> validators,
      final Path dataDirectory,
      final Epoch startEpoch,
      final Epoch catchupEpoch) {
    LOG.info("RANDAO election from epoch {} to epoch {}", startEpoch, catchupEpoch);
    final LightBlock seedBlock = LightBlockLoader.load(blockFile(dataDirectory, startEpoch));
    LOG.info(
        "Seeding epoch {} with prev_randao {} of execution block {}",
        startEpoch,
        seedBlock.prevRandao(),
        seedBlock.blockNumber());

    LightState state =
        LightState.fromSnapshot(config, startEpoch, validators, seedBlock.prevRandao());
    final JsonCommitteeSource source = new JsonCommitteeSource(dataDirectory);
    final List<VerificationResult> results = new ArrayList<>();
    final Stopwatch total = Stopwatch.createStarted();

    Epoch epoch = startEpoch;
    while (true) {
      if (!epoch.equals(startEpoch)) {
        state = advance(state, dataDirectory, epoch);
      }
      LOG.info(
          "Election for epoch {}/{} ({} remaining to catch up)",
          epoch,
          catchupEpoch,
          catchupEpoch.value().minus(epoch.value()));
      results.add(verifier.verifyEpoch(state, epoch, source));
      if (epoch.equals(catchupEpoch)) {
        break;
      }
      epoch = epoch.next();
    }

    final long passed = results.stream().filter(VerificationResult::passed).count();
    LOG.info("{}/{} elections passed ({})", passed, results.size(), total);
    return results;
  }

  private LightState advance(final LightState state, final Path dataDirectory, final Epoch epoch) {
    LightState next = state.withSlot(ChainMath.firstSlotOfEpoch(config, epoch));
    final Path blockFile = blockFile(dataDirectory, epoch);
    if (Files.isRegularFile(blockFile)) {
      next = next.withSeedMix(epoch, LightBlockLoader.load(blockFile).prevRandao());
    } else {
      LOG.warn("No block file for epoch {}, its seed reads an unpopulated ring slot", epoch);
    }
    return next;
  }

  private static boolean hasSlots(final ChainConfig config, final Epoch epoch) {
    return !UInt64.MAX_VALUE.dividedBy(config.slotsPerEpoch()).isLessThan(epoch.value());
  }

  static Path blockFile(final Path dataDirectory, final Epoch epoch) {
    return dataDirectory.resolve("block-" + epoch + ".json");
  }
}
