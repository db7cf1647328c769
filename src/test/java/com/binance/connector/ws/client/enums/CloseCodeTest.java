package com.binance.connector.ws.client.enums;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CloseCodeTest {

    @Test
    @DisplayName("Only normal closure, going away and missing extension are normal")
    void abnormalClassification() {
        EnumSet<CloseCode> normal = EnumSet.of(
            CloseCode.NORMAL_CLOSURE, CloseCode.GOING_AWAY, CloseCode.MANDATORY_EXTENSION_MISSING);

        for (CloseCode code : CloseCode.values()) {
            assertThat(code.isAbnormal()).as(code.name()).isEqualTo(!normal.contains(code));
            assertThat(ClosureState.from(code).isNormal()).as(code.name()).isEqualTo(normal.contains(code));
        }
    }

    @Test
    @DisplayName("Maps numeric codes and falls back to invalid")
    void ofCode() {
        assertThat(CloseCode.of(1000)).isEqualTo(CloseCode.NORMAL_CLOSURE);
        assertThat(CloseCode.of(1006)).isEqualTo(CloseCode.ABNORMAL_CLOSURE);
        assertThat(CloseCode.of(1015)).isEqualTo(CloseCode.TLS_HANDSHAKE_FAILURE);
        assertThat(CloseCode.of(4000)).isEqualTo(CloseCode.INVALID);
        assertThat(CloseCode.of(1004)).isEqualTo(CloseCode.INVALID);
        assertThat(CloseCode.MESSAGE_TOO_BIG.getCode()).isEqualTo(1009);
    }
}
