/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.rollup.stream;

import io.isima.rollup.errors.exception.InvalidConfigurationException;
import io.isima.rollup.models.FieldType;
import io.isima.rollup.models.StreamInfo;
import io.isima.rollup.stream.call.FieldCall;
import io.isima.rollup.stream.call.FieldCallBuilder;
import io.isima.rollup.stream.window.GroupKeyCodec;
import io.isima.rollup.stream.window.WindowAccumulator;
import io.isima.rollup.stream.window.WindowOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Compiled stream registration.
 *
 * <p>Immutable. Reconfiguring a stream builds a new task that replaces the old one.
 */
@Getter
@ToString(of = {"streamInfo", "tagDimKeys", "fieldIndexKeys"})
public class StreamTask {
  /** Private copy of the registration, never handed out. */
  @Getter(AccessLevel.NONE)
  private final StreamInfo streamInfo;

  private final String name;
  private final long id;
  private final String destinationDatabase;

  /** Empty when the registration leaves the retention policy to the database default. */
  private final String destinationRetentionPolicy;

  private final String destinationMeasurement;
  private final List<FieldCall> calls;

  /** Dimension keys that refer to tags, sorted. */
  private final List<String> tagDimKeys;

  /** Dimension keys that refer to fields of the source measurement, in declared order. */
  private final List<String> fieldIndexKeys;

  private final GroupKeyCodec groupKeyCodec;
  private final WindowOptions windowOptions;
  private final WindowAccumulator accumulator;

  private StreamTask(
      StreamInfo streamInfo,
      List<FieldCall> calls,
      List<String> tagDimKeys,
      List<String> fieldIndexKeys) {
    this.streamInfo = streamInfo;
    this.name = streamInfo.getName();
    this.id = streamInfo.getId();
    final var desMst = streamInfo.getDesMst();
    this.destinationDatabase = desMst.getDatabase();
    this.destinationRetentionPolicy = Objects.toString(desMst.getRetentionPolicy(), "");
    this.destinationMeasurement = desMst.getName();
    this.calls = Collections.unmodifiableList(calls);
    this.tagDimKeys = Collections.unmodifiableList(tagDimKeys);
    this.fieldIndexKeys = Collections.unmodifiableList(fieldIndexKeys);
    this.groupKeyCodec = new GroupKeyCodec(tagDimKeys, fieldIndexKeys);
    this.windowOptions = new WindowOptions(streamInfo.getInterval(), streamInfo.getOffset());
    this.accumulator = new WindowAccumulator(streamInfo.getName(), calls, groupKeyCodec);
  }

  /**
   * Compiles a stream registration.
   *
   * <p>The registration is copied, so later changes to the argument do not affect the task.
   *
   * @param streamInfo The registration
   * @param srcSchema Column types of the source measurement
   * @param dstSchema Column types of the destination measurement
   * @return The task
   * @throws InvalidConfigurationException when the registration is invalid
   */
  public static StreamTask build(
      StreamInfo streamInfo, Map<String, FieldType> srcSchema, Map<String, FieldType> dstSchema)
      throws InvalidConfigurationException {
    Objects.requireNonNull(streamInfo, "streamInfo");
    streamInfo = streamInfo.duplicate();
    validate(streamInfo);
    final var calls = FieldCallBuilder.build(streamInfo, srcSchema, dstSchema);

    final var tagDimKeys = new ArrayList<String>();
    final var fieldIndexKeys = new ArrayList<String>();
    for (final var dim : streamInfo.getDims()) {
      if (tagDimKeys.contains(dim) || fieldIndexKeys.contains(dim)) {
        throw new InvalidConfigurationException(
            String.format("stream=%s: duplicate dimension '%s'", streamInfo.getName(), dim));
      }
      final FieldType type = srcSchema != null ? srcSchema.get(dim) : null;
      if (type == null || type == FieldType.TAG) {
        tagDimKeys.add(dim);
      } else {
        fieldIndexKeys.add(dim);
      }
    }
    Collections.sort(tagDimKeys);
    return new StreamTask(streamInfo, calls, tagDimKeys, fieldIndexKeys);
  }

  private static void validate(StreamInfo streamInfo) throws InvalidConfigurationException {
    if (StringUtils.isBlank(streamInfo.getName())) {
      throw new InvalidConfigurationException("stream name is missing");
    }
    if (streamInfo.getInterval() <= 0) {
      throw new InvalidConfigurationException(
          String.format(
              "stream=%s: interval must be positive: %d",
              streamInfo.getName(), streamInfo.getInterval()));
    }
    if (streamInfo.getCalls() == null || streamInfo.getCalls().isEmpty()) {
      throw new InvalidConfigurationException(
          String.format("stream=%s: no aggregate is specified", streamInfo.getName()));
    }
    if (streamInfo.getDims() == null) {
      streamInfo.setDims(new ArrayList<>());
    }
    final var desMst = streamInfo.getDesMst();
    if (desMst == null
        || StringUtils.isBlank(desMst.getDatabase())
        || StringUtils.isBlank(desMst.getName())) {
      throw new InvalidConfigurationException(
          String.format(
              "stream=%s: destination database and measurement are required",
              streamInfo.getName()));
    }
  }

  /** Returns a copy of the registration the task was built from. */
  public StreamInfo getStreamInfo() {
    return streamInfo.duplicate();
  }

  public int dimensionCount() {
    return tagDimKeys.size() + fieldIndexKeys.size();
  }
}
