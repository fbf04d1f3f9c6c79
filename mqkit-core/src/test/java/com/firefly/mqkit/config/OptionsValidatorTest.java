/*
 * Copyright (c) 2026 Firefly Software Solutions Inc.
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
package com.firefly.mqkit.config;

import com.firefly.mqkit.consumer.Strategies;
import com.firefly.mqkit.consumer.SubscribeOptions;
import com.firefly.mqkit.exception.MqKitException;
import com.firefly.mqkit.logging.MqLogger;
import com.firefly.mqkit.serialization.Codecs;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OptionsValidatorTest {

    @Test
    void testValidConnectionOptions() {
        ConnectionOptions options = ConnectionOptions.newOptions(
                Options.addresses("localhost:9092"),
                Options.codec(Codecs.json()),
                Options.sasl("svc", "secret", SaslMechanisms.PLAIN));

        assertThatCode(() -> OptionsValidator.validate(options)).doesNotThrowAnyException();
    }

    @Test
    void testNoAddresses() {
        ConnectionOptions options = ConnectionOptions.newOptions(Options.codec(Codecs.json()));

        assertThatThrownBy(() -> OptionsValidator.validate(options))
                .isInstanceOf(MqKitException.class)
                .hasMessageContaining("No broker addresses");
    }

    @Test
    void testMissingCodec() {
        ConnectionOptions options = ConnectionOptions.newOptions(Options.addresses("localhost:9092"));

        MqKitException e = catchThrowableOfType(() -> OptionsValidator.validate(options), MqKitException.class);

        assertThat(e).hasMessageContaining("No codec");
        assertThat(e.getHint()).contains("Options.codec");
    }

    @Test
    void testPartialSaslCredentials() {
        ConnectionOptions options = ConnectionOptions.newOptions(
                Options.addresses("localhost:9092"),
                Options.codec(Codecs.json()),
                Options.sasl("svc", "", SaslMechanisms.PLAIN));

        assertThatThrownBy(() -> OptionsValidator.validate(options))
                .isInstanceOf(MqKitException.class)
                .hasMessageContaining("missing: password");
    }

    @Test
    void testTlsMaterialWithoutSecureOnlyWarns() throws Exception {
        RecordingLogger logger = new RecordingLogger();
        ConnectionOptions options = ConnectionOptions.newOptions(
                Options.addresses("localhost:9092"),
                Options.codec(Codecs.json()),
                Options.tlsConfig(TlsConfig.builder().caFile("/etc/ca.crt").build()),
                Options.log(logger));

        OptionsValidator.validate(options);

        assertThat(logger.warnings).hasSize(1);
        assertThat(logger.warnings.get(0)).contains("secure transport is disabled");
    }

    @Test
    void testSubscribeDefaultsAreValid() {
        assertThatCode(() -> OptionsValidator.validate(SubscribeOptions.newSubscribeOptions()))
                .doesNotThrowAnyException();
    }

    @Test
    void testNegativeRetryNumRejectedAtConsumption() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeRetryNum(-1));

        assertThat(options.getRetryNum()).isEqualTo(-1);
        assertThatThrownBy(() -> OptionsValidator.validate(options))
                .isInstanceOf(MqKitException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void testBlankStrategyIdentityRejected() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeStrategy(() -> ""));

        assertThatThrownBy(() -> OptionsValidator.validate(options))
                .isInstanceOf(MqKitException.class)
                .hasMessageContaining("Strategy identity");
    }

    @Test
    void testCustomStrategyAccepted() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeStrategy(Strategies.custom("park")));

        assertThatCode(() -> OptionsValidator.validate(options)).doesNotThrowAnyException();
    }

    private static class RecordingLogger implements MqLogger {
        final List<String> warnings = new ArrayList<>();

        @Override
        public void info(Object... args) { }

        @Override
        public void warn(Object... args) {
            StringBuilder sb = new StringBuilder();
            for (Object a : args) {
                sb.append(a).append(' ');
            }
            warnings.add(sb.toString().trim());
        }

        @Override
        public void error(Object... args) { }

        @Override
        public void errorf(String format, Object... args) { }

        @Override
        public void infof(String format, Object... args) { }
    }
}
