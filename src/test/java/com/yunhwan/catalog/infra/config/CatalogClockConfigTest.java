package com.yunhwan.catalog.infra.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.yunhwan.catalog.testsupport.fixtures.ProductFixtures.FIXED_CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CatalogClockConfigTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(CatalogClockConfig.class);

    @Test
    @DisplayName("기본 Clock은 UTC 시스템 시계")
    void 기본_UTC() {
        contextRunner.run(ctx -> {
            assertThat(ctx).hasSingleBean(Clock.class);
            assertThat(ctx.getBean(Clock.class).getZone()).isEqualTo(ZoneOffset.UTC);
        });
    }

    @Test
    @DisplayName("Clock 빈을 직접 주면 기본 시계는 만들어지지 않는다")
    void 주입한_Clock_우선() {
        contextRunner
                .withBean("fixedClock", Clock.class, () -> FIXED_CLOCK)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(Clock.class);
                    assertThat(ctx.getBean(Clock.class)).isSameAs(FIXED_CLOCK);
                });
    }
}
