package org.paycron.config;

import org.paycron.config.utils.EnvProvider;
import org.paycron.config.utils.XmlUtil;
import org.paycron.exceptions.ConfigurationException;
import org.paycron.nodes.ConnectionConfig;
import org.paycron.services.jobs.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "config.xml";

    static final String DEFAULT_CONFIG = """
            <?xml version="1.0" encoding="UTF-8"?>
            <configuration>
                <node>
                    <serverUrl>https://localhost:8080</serverUrl>
                    <certPath>~/.lnd/tls.cert</certPath>
                    <macaroonPath>~/.lnd/data/chain/bitcoin/mainnet/admin.macaroon</macaroonPath>
                </node>
                <http>
                    <connectTimeoutSeconds>10</connectTimeoutSeconds>
                    <requestTimeoutSeconds>30</requestTimeoutSeconds>
                </http>
                <logging>
                    <level>INFO</level>
                    <logFile>logs/paycron.log</logFile>
                </logging>
                <jobs>
                    <!--
                    <job>
                        <name>My first job</name>
                        <cronExpression>0 30 9,12,15 1,15 May-Aug ? 2030/2</cronExpression>
                        <amountSats>10000</amountSats>
                        <lnAddressOrLnurl>nick@domain.com</lnAddressOrLnurl>
                        <maxFeeSats>5</maxFeeSats>
                        <memo>Scheduled payment coming your way!</memo>
                    </job>
                    -->
                </jobs>
            </configuration>
            """;

    private ConfigLoader() {}

    /**
     * Loads the XML file and returns a fully-typed XmlConfiguration object.
     * A missing file is created from the commented template first.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        Path path = Paths.get(xmlPath);
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
        }
        try {
            Document doc = XmlUtil.parse(path);
            return XmlUtil.unmarshal(doc, XmlConfiguration.class);
        } catch (Exception e) {
            throw new ConfigurationException("Failed to parse config " + xmlPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the loaded configuration and turns it into the values the
     * scheduler works with. Cron expressions are checked later, when jobs are built.
     */
    public static ValidConfig validate(XmlConfiguration cfg, String xmlPath) {
        if (cfg.node == null || isBlank(cfg.node.serverUrl)) {
            throw new ConfigurationException("Missing <node><serverUrl> in " + xmlPath);
        }
        if (isBlank(cfg.node.certPath) || isBlank(cfg.node.macaroonPath)) {
            throw new ConfigurationException("Missing <node> certPath or macaroonPath in " + xmlPath);
        }
        if (cfg.jobs == null || cfg.jobs.isEmpty()) {
            throw new ConfigurationException("No jobs to run. Add a job in " + xmlPath);
        }

        String home = EnvProvider.homeDir();
        ConnectionConfig connection = new ConnectionConfig(
                cfg.node.serverUrl.trim(),
                expandHome(cfg.node.certPath.trim(), home),
                expandHome(cfg.node.macaroonPath.trim(), home),
                Duration.ofSeconds(Math.max(cfg.node.connectTimeoutSeconds, 1))
        );

        List<JobDefinition> definitions = new ArrayList<>();
        int index = 0;
        for (XmlConfiguration.JobEntry entry : cfg.jobs) {
            index++;
            if (isBlank(entry.cronExpression)) {
                throw new ConfigurationException("Job #" + index + " has no cronExpression");
            }
            if (isBlank(entry.lnAddressOrLnurl)) {
                throw new ConfigurationException("Job #" + index + " has no lnAddressOrLnurl");
            }
            definitions.add(new JobDefinition(
                    blankToNull(entry.name),
                    entry.cronExpression.trim(),
                    entry.amountSats,
                    entry.lnAddressOrLnurl.trim(),
                    entry.maxFeeSats,
                    entry.memo
            ));
        }

        XmlConfiguration.Http http = cfg.http != null ? cfg.http : new XmlConfiguration.Http();
        logger.debug("Validated configuration: {} job(s), node={}", definitions.size(), connection.serverUrl());

        return new ValidConfig(
                connection,
                List.copyOf(definitions),
                Duration.ofSeconds(Math.max(http.connectTimeoutSeconds, 1)),
                Duration.ofSeconds(Math.max(http.requestTimeoutSeconds, 1))
        );
    }

    static Path expandHome(String path, String home) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(home + path.substring(1));
        }
        return Paths.get(path);
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, DEFAULT_CONFIG, StandardCharsets.UTF_8);
            logger.warn("Config file {} not found, wrote a default one. Add your node and jobs to it.", path);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to create default config " + path, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    /** Configuration after validation. */
    public record ValidConfig(
            ConnectionConfig connection,
            List<JobDefinition> jobs,
            Duration httpConnectTimeout,
            Duration httpRequestTimeout
    ) {}
}
