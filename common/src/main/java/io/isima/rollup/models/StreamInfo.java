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
package io.isima.rollup.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Registration of a stream task.
 *
 * <p>A stream task aggregates rows written to a source measurement into fixed time windows,
 * grouped by the dimension keys, and writes one row per group and window to the destination
 * measurement.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "id", "calls", "dims", "interval", "offset", "desMst"})
public class StreamInfo {
  @JsonProperty("name")
  private String name;

  @JsonProperty("id")
  private long id;

  /** Aggregates in output order. */
  @JsonProperty("calls")
  private List<StreamCall> calls = new ArrayList<>();

  /** Group-by dimension keys. */
  @JsonProperty("dims")
  private List<String> dims = new ArrayList<>();

  /** Window length in nanoseconds. */
  @JsonProperty("interval")
  private long interval;

  /** Window offset in nanoseconds. */
  @JsonProperty("offset")
  private long offset;

  /** Destination measurement. */
  @JsonProperty("desMst")
  private DestinationMeasurement desMst;

  public StreamInfo() {}

  public StreamInfo(String name, long id) {
    this.name = name;
    this.id = id;
  }

  /** Returns a deep copy of the registration. */
  public StreamInfo duplicate() {
    final var clone = new StreamInfo(name, id);
    if (calls != null) {
      for (final var call : calls) {
        clone.calls.add(call != null ? call.duplicate() : null);
      }
    } else {
      clone.calls = null;
    }
    clone.dims = dims != null ? new ArrayList<>(dims) : null;
    clone.interval = interval;
    clone.offset = offset;
    clone.desMst = desMst != null ? desMst.duplicate() : null;
    return clone;
  }

  public StreamInfo addCall(String field, String alias, String call) {
    calls.add(new StreamCall(field, alias, call));
    return this;
  }
}
