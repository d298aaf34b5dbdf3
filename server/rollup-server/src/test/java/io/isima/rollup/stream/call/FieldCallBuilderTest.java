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
package io.isima.rollup.stream.call;

import static io.isima.rollup.stream.StreamTestUtils.SRC_SCHEMA;
import static io.isima.rollup.stream.StreamTestUtils.streamInfo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.junit.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import io.isima.rollup.errors.GenericError;
import io.isima.rollup.errors.exception.InvalidConfigurationException;
import io.isima.rollup.models.AggregateFunction;
import io.isima.rollup.models.FieldType;
import java.util.Map;
import org.junit.Test;

public class FieldCallBuilderTest {

  @Test
  public void testBuildInDeclarationOrder() throws Exception {
    final var info =
        streamInfo("s", 60)
            .addCall("value", "total", "sum")
            .addCall("value", "n", "COUNT")
            .addCall("status", "worst", " Max ")
            .addCall("value", "low", "min");
    final var calls = FieldCallBuilder.build(info, SRC_SCHEMA, Map.of());

    assertEquals(4, calls.size());
    for (int i = 0; i < calls.size(); ++i) {
      assertEquals(i, calls.get(i).getSourceIndex());
      assertEquals(i, calls.get(i).getDestIndex());
    }
    assertThat(calls.get(0).getFunction(), is(AggregateFunction.SUM));
    assertThat(calls.get(1).getFunction(), is(AggregateFunction.COUNT));
    assertThat(calls.get(2).getFunction(), is(AggregateFunction.MAX));
    assertThat(calls.get(2).getName(), is("status"));
    assertThat(calls.get(2).getAlias(), is("worst"));
    assertThat(calls.get(3).getFunction(), is(AggregateFunction.MIN));
  }

  @Test
  public void testOutputTypes() throws Exception {
    final var info =
        streamInfo("s", 60)
            .addCall("value", "total", "sum")
            .addCall("value", "n", "count")
            .addCall("status", "worst", "max")
            .addCall("unknown", "u", "sum")
            .addCall("value", "declared", "sum");
    final var calls =
        FieldCallBuilder.build(info, SRC_SCHEMA, Map.of("declared", FieldType.INTEGER));

    assertThat(calls.get(0).getOutputType(), is(FieldType.FLOAT));
    assertThat(calls.get(1).getOutputType(), is(FieldType.INTEGER));
    assertThat(calls.get(2).getOutputType(), is(FieldType.INTEGER));
    assertThat(calls.get(3).getOutputType(), is(FieldType.FLOAT));
    assertThat(calls.get(3).getInputType(), nullValue());
    assertThat(calls.get(4).getOutputType(), is(FieldType.INTEGER));
  }

  @Test
  public void testAliasDefaultsToField() throws Exception {
    final var info = streamInfo("s", 60).addCall("value", null, "sum");
    assertThat(FieldCallBuilder.build(info, SRC_SCHEMA, null).get(0).getAlias(), is("value"));
  }

  @Test
  public void testUnknownFunction() {
    final var info = streamInfo("s", 60).addCall("value", "p", "percentile");
    try {
      FieldCallBuilder.build(info, SRC_SCHEMA, Map.of());
      fail("exception is expected");
    } catch (InvalidConfigurationException e) {
      assertThat(e.getInfo(), is(GenericError.INVALID_CONFIGURATION));
      assertThat(e.getMessage(), containsString("percentile"));
    }
  }

  @Test
  public void testAccumulate() throws Exception {
    final var info = streamInfo("s", 60).addCall("value", "n", "count");
    final var call = FieldCallBuilder.build(info, SRC_SCHEMA, Map.of()).get(0);
    assertEquals(1.0, call.accumulate(0.0, 123.0), 0.0);
    assertEquals(3.0, call.accumulate(2.0, -1.0), 0.0);
  }
}
