package dev.mars.pgprojection.api.error;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

/**
 * A shard tried to record progress from a floor that is no longer the stored progress,
 * meaning another process moved the shard in the meantime.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ProgressionOutOfOrderException extends ConcurrencyException {

    public ProgressionOutOfOrderException(String shardName, long floor) {
        super("Progression for " + shardName + " is out of order, expected floor " + floor,
                "progression", shardName);
    }
}
