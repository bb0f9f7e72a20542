package com.pagelens.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class NetworkCheckTest {

    @Test
    void counts_reachable_targets_and_reports_failures() {
        NetworkCheck check = new NetworkCheck(t -> {
            if (t.name().equals("GitHub")) throw new ConnectException("Connection refused");
            return 200;
        });
        ByteArrayOutputStream buf = new ByteArrayOutputStream();

        int reachable = check.run(NetworkCheck.TARGETS, new PrintStream(buf, true, StandardCharsets.UTF_8));

        assertThat(reachable).isEqualTo(2);
        String out = buf.toString(StandardCharsets.UTF_8);
        assertThat(out).contains("✅ Tencent").contains("❌ GitHub: unreachable (ConnectException: Connection refused)");
    }
}
