package com.sitedigest.core.util;

import com.sitedigest.core.testutil.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RequestPacerTest {

    @Test
    void first_acquire_is_free_then_slots_are_spaced_by_interval() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RequestPacer pacer = new RequestPacer(Duration.ofSeconds(1), sleeper);

        pacer.acquire();
        pacer.acquire();
        pacer.acquire();

        // 실제로 자지 않으므로 두 번째는 ~1s, 세 번째는 ~2s 대기
        assertThat(sleeper.sleeps).hasSize(2);
        assertThat(sleeper.sleeps.get(0)).isBetween(Duration.ofMillis(900), Duration.ofSeconds(1));
        assertThat(sleeper.sleeps.get(1)).isBetween(Duration.ofMillis(1900), Duration.ofSeconds(2));
    }

    @Test
    void zero_interval_never_sleeps() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RequestPacer pacer = new RequestPacer(Duration.ZERO, sleeper);
        for (int i = 0; i < 5; i++) pacer.acquire();
        assertThat(sleeper.sleeps).isEmpty();
    }
}
