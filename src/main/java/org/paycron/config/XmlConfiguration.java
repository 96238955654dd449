package org.paycron.config;

import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;
import jakarta.xml.bind.annotation.XmlRootElement;

import java.util.List;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Node node;
    public Http http;
    public Logging logging;

    @XmlElementWrapper(name = "jobs")
    @XmlElement(name = "job")
    public List<JobEntry> jobs;

    // --- Lightning node (LND REST) ---
    @XmlRootElement(name = "node")
    public static class Node {
        public String serverUrl;
        public String certPath;
        public String macaroonPath;
        public int connectTimeoutSeconds = 10;
    }

    // --- Outbound LNURL requests ---
    @XmlRootElement(name = "http")
    public static class Http {
        public int connectTimeoutSeconds = 10;
        public int requestTimeoutSeconds = 30;
    }

    // --- Logging ---
    @XmlRootElement(name = "logging")
    public static class Logging {
        public String level;
        public String logFile;
    }

    // --- Scheduled payments ---
    @XmlRootElement(name = "job")
    public static class JobEntry {
        public String name;
        public String cronExpression;
        public long amountSats;
        public String lnAddressOrLnurl;
        public Long maxFeeSats;
        public String memo;
    }
}
