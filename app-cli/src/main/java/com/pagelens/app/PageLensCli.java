package com.pagelens.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pagelens.core.model.FetchOutcome;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.PageReport;
import com.pagelens.core.service.BlockedSitePolicy;
import com.pagelens.core.service.PageInspectionService;
import com.pagelens.core.util.LoggingConfigurator;
import com.pagelens.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 진입점.
 * 종료 코드: 0 정상(또는 차단 사이트 확인 거절), 1 사용법/설정 오류, 2 페치 실패.
 */
@Command(
    name = "pagelens",
    description = "Fetch one page and run basic SEO checks (content visibility, title, meta description, H1, image alt, canonical)",
    mixinStandardHelpOptions = true,
    version = "0.1.0"
)
public final class PageLensCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PageLensCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FETCH_FAILED = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<url>", description = "Page to inspect")
    private String url;

    @Option(names = "--config", paramLabel = "<file>", description = "YAML config file (default: ./pagelens.yml if present)")
    private Path configFile;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    @Option(names = {"-y", "--yes"}, description = "Do not ask before inspecting a possibly blocked site")
    private boolean assumeYes;

    @Option(names = "--timeout", paramLabel = "<seconds>", description = "Request timeout in seconds (overrides config)")
    private Long timeoutSeconds;

    @Option(names = "--check-network", description = "Check connectivity to reference sites and exit")
    private boolean checkNetwork;

    @Spec
    private CommandSpec spec;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Function<InspectConfig, PageInspectionService> serviceFactory;
    private final NetworkCheck networkCheck;

    public PageLensCli(InputStream in, PrintStream out, PrintStream err) {
        this(in, out, err, PageInspectionService::new, new NetworkCheck());
    }

    /** 테스트용: 서비스/네트워크 점검 주입 */
    PageLensCli(InputStream in, PrintStream out, PrintStream err,
                Function<InspectConfig, PageInspectionService> serviceFactory,
                NetworkCheck networkCheck) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.serviceFactory = serviceFactory;
        this.networkCheck = networkCheck;
    }

    public static void main(String[] args) {
        LoggingConfigurator.initFromSystemProperties();
        int code = new PageLensCli(System.in, System.out, System.err).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        CommandLine cmd = new CommandLine(this);
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        // picocli 기본값(2)은 페치 실패 코드와 겹친다
        cmd.setParameterExceptionHandler((ex, argv) -> {
            CommandLine c = ex.getCommandLine();
            c.getErr().println(ex.getMessage());
            c.usage(c.getErr());
            return EXIT_USAGE;
        });
        return cmd.execute(args);
    }

    @Override
    public Integer call() {
        if (checkNetwork) {
            networkCheck.run(NetworkCheck.TARGETS, out);
            return EXIT_OK;
        }
        if (url == null || url.isBlank()) {
            throw new ParameterException(spec.commandLine(), "Missing URL");
        }
        if (timeoutSeconds != null && timeoutSeconds < 1) {
            throw new ParameterException(spec.commandLine(), "--timeout must be >= 1");
        }

        InspectConfig config;
        try {
            config = loadConfig();
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Configuration error", e);
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }

        ConsoleReporter console = new ConsoleReporter(out);

        Optional<String> blocked = new BlockedSitePolicy(config.getBlockedSites()).match(url);
        if (blocked.isPresent() && !assumeYes && !confirmBlocked(blocked.get(), console)) {
            return EXIT_OK;
        }

        PageInspectionService service = serviceFactory.apply(config);
        if (!json) console.header(url);

        FetchOutcome outcome = service.fetch(url);
        if (!outcome.isSuccess()) {
            console.fetchFailed(url, outcome.getFailure() + ": " + outcome.getDetail());
            return EXIT_FETCH_FAILED;
        }
        PageReport report = service.analyze(outcome.getResponse().orElseThrow());

        if (json) {
            try {
                out.println(new JsonReporter().toJson(report));
            } catch (JsonProcessingException e) {
                // 모델이 Map/기본형뿐이라 실제로는 발생하지 않아야 함
                throw new IllegalStateException("Failed to serialize report", e);
            }
        } else {
            console.render(report);
        }
        return EXIT_OK;
    }

    private InspectConfig loadConfig() throws IOException {
        InspectConfig cfg = (configFile != null)
                ? YamlConfigLoader.load(configFile)
                : YamlConfigLoader.loadDefault();
        if (timeoutSeconds != null) cfg.setTimeoutSeconds(timeoutSeconds);
        cfg.validate();
        return cfg;
    }

    /** y 이외 입력(또는 EOF)은 거절로 처리 */
    private boolean confirmBlocked(String site, ConsoleReporter console) {
        out.println("⚠️  Note: " + site + " may not be directly reachable from mainland China.");
        console.suggestions();
        out.print("Continue anyway? (y/n): ");
        out.flush();
        try {
            BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String answer = r.readLine();
            return answer != null && answer.trim().toLowerCase(Locale.ROOT).equals("y");
        } catch (IOException e) {
            LOG.warn("Could not read confirmation", e);
            return false;
        }
    }
}
