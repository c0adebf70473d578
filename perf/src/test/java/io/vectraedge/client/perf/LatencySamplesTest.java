/*
 * Copyright © 2026 The VectraEdge Authors
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
package io.vectraedge.client.perf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LatencySamplesTest {

    @Test
    void empty() {
        var samples = new LatencySamples();

        assertThat(samples.isEmpty()).isTrue();
        assertThat(samples.count()).isZero();
        assertThat(samples.meanMs()).isZero();
        assertThat(samples.minMs()).isZero();
        assertThat(samples.maxMs()).isZero();
    }

    @Test
    void statistics() {
        var samples = new LatencySamples();
        samples.record(TimeUnit.MILLISECONDS.toNanos(1));
        samples.record(TimeUnit.MILLISECONDS.toNanos(2));
        samples.record(TimeUnit.MICROSECONDS.toNanos(4500));
        samples.fail();

        assertThat(samples.count()).isEqualTo(3);
        assertThat(samples.failures()).isEqualTo(1);
        assertThat(samples.meanMs()).isCloseTo(2.5, within(1e-9));
        assertThat(samples.minMs()).isEqualTo(1.0);
        assertThat(samples.maxMs()).isEqualTo(4.5);

        var snapshot = samples.snapshot();
        assertThat(snapshot.p50()).isCloseTo(2.0, within(0.01));
        assertThat(snapshot.max()).isCloseTo(4.5, within(0.01));
    }

    @Test
    void failuresOnly() {
        var samples = new LatencySamples();
        samples.fail();
        samples.fail();

        assertThat(samples.isEmpty()).isTrue();
        assertThat(samples.failures()).isEqualTo(2);
    }

    @Test
    void negativeLatency() {
        assertThatThrownBy(() -> new LatencySamples().record(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
