/*
 * Copyright ConsenSys AG.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.hyperledger.beacon.election.config;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The chain constants the committee election depends on.
 *
 * <p>Instances are immutable so that several chain configurations (mainnet, a testnet, the minimal
 * preset used by tests) can be used side by side.
 *
 * @param slotsPerEpoch number of slots in one epoch
 * @param targetCommitteeSize committee size the per-slot committee count aims for
 * @param maxCommitteesPerSlot upper bound of the per-slot committee count
 * @param epochsPerHistoricalVector length of the RANDAO mix ring
 * @param minSeedLookahead how many epochs ahead of its use a seed is fixed
 * @param shuffleRoundCount number of swap-or-not rounds
 */
public record ChainConfig(
    int slotsPerEpoch,
    int targetCommitteeSize,
    int maxCommitteesPerSlot,
    int epochsPerHistoricalVector,
    int minSeedLookahead,
    int shuffleRoundCount) {

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#misc
  public static final ChainConfig MAINNET = new ChainConfig(32, 128, 64, 65536, 1, 90);

  public static final ChainConfig MINIMAL = new ChainConfig(8, 4, 4, 64, 1, 10);

  static final String SLOTS_PER_EPOCH = "SLOTS_PER_EPOCH";
  static final String TARGET_COMMITTEE_SIZE = "TARGET_COMMITTEE_SIZE";
  static final String MAX_COMMITTEES_PER_SLOT = "MAX_COMMITTEES_PER_SLOT";
  static final String EPOCHS_PER_HISTORICAL_VECTOR = "EPOCHS_PER_HISTORICAL_VECTOR";
  static final String MIN_SEED_LOOKAHEAD = "MIN_SEED_LOOKAHEAD";
  static final String SHUFFLE_ROUND_COUNT = "SHUFFLE_ROUND_COUNT";
  static final String PRESET_BASE = "PRESET_BASE";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public ChainConfig {
    checkArgument(slotsPerEpoch > 0, "slotsPerEpoch must be positive: %s", slotsPerEpoch);
    checkArgument(
        targetCommitteeSize > 0, "targetCommitteeSize must be positive: %s", targetCommitteeSize);
    checkArgument(
        maxCommitteesPerSlot > 0,
        "maxCommitteesPerSlot must be positive: %s",
        maxCommitteesPerSlot);
    checkArgument(
        epochsPerHistoricalVector > 0,
        "epochsPerHistoricalVector must be positive: %s",
        epochsPerHistoricalVector);
    checkArgument(
        minSeedLookahead >= 0 && minSeedLookahead < epochsPerHistoricalVector,
        "minSeedLookahead must be in [0, %s): %s",
        epochsPerHistoricalVector,
        minSeedLookahead);
    // the round number is serialized on a single byte
    checkArgument(
        shuffleRoundCount > 0 && shuffleRoundCount <= 256,
        "shuffleRoundCount must be in [1, 256]: %s",
        shuffleRoundCount);
  }

  /**
   * Builds a configuration from a JSON object keyed by the upper-case constant names. An optional
   * {@code PRESET_BASE} ("mainnet" or "minimal") selects the defaults for the keys that are absent.
   *
   * @param configRoot the config root
   * @return the chain config
   */
  public static ChainConfig fromConfig(final ObjectNode configRoot) {
    final ChainConfig base = presetBase(configRoot);
    try {
      return new ChainConfig(
          intValue(configRoot, SLOTS_PER_EPOCH, base.slotsPerEpoch()),
          intValue(configRoot, TARGET_COMMITTEE_SIZE, base.targetCommitteeSize()),
          intValue(configRoot, MAX_COMMITTEES_PER_SLOT, base.maxCommitteesPerSlot()),
          intValue(configRoot, EPOCHS_PER_HISTORICAL_VECTOR, base.epochsPerHistoricalVector()),
          intValue(configRoot, MIN_SEED_LOOKAHEAD, base.minSeedLookahead()),
          intValue(configRoot, SHUFFLE_ROUND_COUNT, base.shuffleRoundCount()));
    } catch (IllegalArgumentException e) {
      throw new ChainConfigException("Invalid chain config: " + e.getMessage(), e);
    }
  }

  /**
   * Reads a configuration from a JSON file.
   *
   * @param configFile path of the JSON file
   * @return the chain config
   */
  public static ChainConfig fromFile(final Path configFile) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(configFile.toFile());
    } catch (IOException e) {
      throw new ChainConfigException("Unable to read chain config " + configFile, e);
    }
    if (root == null || !root.isObject()) {
      throw new ChainConfigException("Chain config " + configFile + " is not a JSON object");
    }
    return fromConfig((ObjectNode) root);
  }

  private static ChainConfig presetBase(final ObjectNode configRoot) {
    final JsonNode preset = configRoot.get(PRESET_BASE);
    if (preset == null || preset.isNull()) {
      return MAINNET;
    }
    switch (preset.asText().toLowerCase(Locale.ROOT)) {
      case "mainnet":
        return MAINNET;
      case "minimal":
        return MINIMAL;
      default:
        throw new ChainConfigException("Unknown preset base: " + preset.asText());
    }
  }

  private static int intValue(final ObjectNode configRoot, final String key, final int fallback) {
    final JsonNode node = configRoot.get(key);
    if (node == null || node.isNull()) {
      return fallback;
    }
    // consensus config files quote their numbers
    final String text = node.asText().trim();
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new ChainConfigException("Invalid value for " + key + ": " + text, e);
    }
  }
}
