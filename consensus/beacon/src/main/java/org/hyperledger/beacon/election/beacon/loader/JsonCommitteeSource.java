package org.hyperledger.beacon.election.beacon.loader;

import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.verification.CommitteeSource;

/** Reads the expected committees of epoch {@code N} from a {@code committees-N.json} file. */
public class JsonCommitteeSource implements CommitteeSource {

  private final Path directory;

  public JsonCommitteeSource(final Path directory) {
    this.directory = checkNotNull(directory, "directory");
  }

  public static Path committeesFile(final Path directory, final Epoch epoch) {
    return directory.resolve("committees-" + epoch + ".json");
  }

  @Override
  public List<BeaconCommittee> committeesForEpoch(final Epoch epoch) {
    final Path file = committeesFile(directory, epoch);
    if (!Files.isRegularFile(file)) {
      throw new ChainDataException("No committees file for epoch " + epoch + ": " + file);
    }
    return CommitteeDataLoader.load(file);
  }
}
