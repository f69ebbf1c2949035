/*
 * Copyright 2022 Rackspace US, Inc.
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

package com.rackspace.helios.app.services;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.SeriesRef;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class HashService {
    private final HashFunction hashFunction;
    private static final Charset HASHING_CHARSET = StandardCharsets.UTF_8;

    @Autowired
    public HashService() {
        hashFunction = Hashing.murmur3_128();
    }

    /**
     * Identifies a forecast model by what determines it: the series, its regressors, the
     * training window and the configuration.
     */
    public String modelId(String entityId, String metric, List<SeriesRef> exogenous,
                          Instant trainingStart, Instant trainingEnd, ForecastConfig config) {
        final Hasher hasher = hashFunction.newHasher()
                .putString(entityId, HASHING_CHARSET)
                .putChar('\0')
                .putString(metric, HASHING_CHARSET)
                .putChar('\0');
        exogenous.forEach(ref -> hasher.putString(ref.toString(), HASHING_CHARSET).putChar('\0'));
        return hasher
                .putLong(trainingStart.toEpochMilli())
                .putLong(trainingEnd.toEpochMilli())
                .putInt(config.getSeasonalPeriod())
                .putInt(config.getArOrder())
                .putInt(config.getMaOrder())
                .putDouble(config.getConfidenceLevel())
                .putInt(config.getMaxIterations())
                .putDouble(config.getTolerance())
                .putDouble(config.getRidge())
                .hash()
                .toString();
    }
}
