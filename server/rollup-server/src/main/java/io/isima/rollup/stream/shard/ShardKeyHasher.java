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
package io.isima.rollup.stream.shard;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/** Hash of shard keys used to pick a shard of a hash-partitioned shard group. */
public class ShardKeyHasher {
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  private ShardKeyHasher() {}

  public static long hash(byte[] key) {
    return hash(key, 0, key.length);
  }

  public static long hash(byte[] key, int offset, int length) {
    return HASH_FUNCTION.hashBytes(key, offset, length).asLong();
  }
}
