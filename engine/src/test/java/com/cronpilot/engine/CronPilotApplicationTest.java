package com.cronpilot.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CronPilotApplicationTest {

    @Test
    void commandArgument_startsCli() {
        assertThat(CronPilotApplication.isCliInvocation(new String[]{"run-now", "news"})).isTrue();
    }

    @Test
    void noArgumentsOrSpringOptions_startService() {
        assertThat(CronPilotApplication.isCliInvocation(new String[0])).isFalse();
        assertThat(CronPilotApplication.isCliInvocation(new String[]{"--server.port=9090"})).isFalse();
    }
}
