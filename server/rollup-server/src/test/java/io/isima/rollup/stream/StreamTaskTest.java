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

import static io.isima.rollup.stream.StreamTestUtils.DATABASE;
import static io.isima.rollup.stream.StreamTestUtils.DESTINATION;
import static io.isima.rollup.stream.StreamTestUtils.SRC_SCHEMA;
import static io.isima.rollup.stream.StreamTestUtils.streamInfo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.junit.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

import io.isima.rollup.errors.exception.InvalidConfigurationException;
import io.isima.rollup.models.DestinationMeasurement;
import io.isima.rollup.models.StreamInfo;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class StreamTaskTest {

  @Test
  public void testDimensionSplit() throws Exception {
    final var info =
        streamInfo("s", 60, "region", "status", "host", "unknownTag").addCall("value", "t", "sum");
    final var task = StreamTask.build(info, SRC_SCHEMA, Map.of());
    assertThat(task.getTagDimKeys(), is(List.of("host", "region", "unknownTag")));
    assertThat(task.getFieldIndexKeys(), is(List.of("status")));
    assertEquals(4, task.dimensionCount());
    assertEquals(60, task.getWindowOptions().getInterval());
    assertEquals("s", task.getName());
    assertEquals(42, task.getId());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNonPositiveInterval() throws Exception {
    StreamTask.build(streamInfo("s", 0).addCall("value", "t", "sum"), SRC_SCHEMA, Map.of());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNoCalls() throws Exception {
    StreamTask.build(streamInfo("s", 60), SRC_SCHEMA, Map.of());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testMissingDestination() throws Exception {
    final var info = new StreamInfo("s", 1).addCall("value", "t", "sum");
    info.setInterval(60);
    StreamTask.build(info, SRC_SCHEMA, Map.of());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testDuplicateDimension() throws Exception {
    StreamTask.build(
        streamInfo("s", 60, "host", "host").addCall("value", "t", "sum"), SRC_SCHEMA, Map.of());
  }

  @Test
  public void testRegistrationIsCopied() throws Exception {
    final var info = streamInfo("s", 60, "host").addCall("value", "t", "sum");
    final var task = StreamTask.build(info, SRC_SCHEMA, Map.of());

    info.setInterval(120);
    info.setDesMst(new DestinationMeasurement("other", "rp1", "x"));
    info.getDims().add("region");
    info.getCalls().get(0).setCall("max");

    assertEquals(60, task.getWindowOptions().getInterval());
    assertEquals(DATABASE, task.getDestinationDatabase());
    assertEquals("", task.getDestinationRetentionPolicy());
    assertEquals(DESTINATION, task.getDestinationMeasurement());
    assertThat(task.getTagDimKeys(), is(List.of("host")));
    final var snapshot = task.getStreamInfo();
    assertThat(snapshot.getDims(), is(List.of("host")));
    assertEquals("sum", snapshot.getCalls().get(0).getCall());

    snapshot.getDesMst().setDatabase("changed");
    assertEquals(DATABASE, task.getDestinationDatabase());
    assertEquals(DATABASE, task.getStreamInfo().getDesMst().getDatabase());
  }

  @Test
  public void testNullDimsLeavesArgumentUntouched() throws Exception {
    final var info = streamInfo("s", 60).addCall("value", "t", "sum");
    info.setDims(null);
    final var task = StreamTask.build(info, SRC_SCHEMA, Map.of());
    assertEquals(0, task.dimensionCount());
    assertThat(info.getDims(), nullValue());
  }
}
