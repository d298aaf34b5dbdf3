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
package io.isima.rollup.meta;

import io.isima.rollup.errors.exception.NoSuchRetentionPolicyException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Database metadata: retention policies and the database-wide shard key. */
@Getter
@Setter
@ToString
public class DatabaseInfo {
  private String name;
  private String defaultRetentionPolicy;

  /** Database-wide shard key. Null or keyless when the measurements declare their own. */
  private ShardKeyInfo shardKey;

  private final Map<String, RetentionPolicyInfo> retentionPolicies = new LinkedHashMap<>();

  public DatabaseInfo() {}

  public DatabaseInfo(String name, String defaultRetentionPolicy) {
    this.name = name;
    this.defaultRetentionPolicy = defaultRetentionPolicy;
  }

  public DatabaseInfo addRetentionPolicy(RetentionPolicyInfo retentionPolicy) {
    retentionPolicies.put(retentionPolicy.getName(), retentionPolicy);
    return this;
  }

  /**
   * Looks up a retention policy.
   *
   * @param rpName Retention policy name
   * @return The retention policy
   * @throws NoSuchRetentionPolicyException when the database does not have the policy
   */
  public RetentionPolicyInfo getRetentionPolicy(String rpName)
      throws NoSuchRetentionPolicyException {
    final var rp = rpName != null ? retentionPolicies.get(rpName) : null;
    if (rp == null) {
      throw new NoSuchRetentionPolicyException(name, rpName);
    }
    return rp;
  }

  public boolean hasShardKey() {
    return shardKey != null && shardKey.hasKeys();
  }
}
