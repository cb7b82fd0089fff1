package com.questrail.syslog.format;

import com.questrail.syslog.api.Facility;
import com.questrail.syslog.api.Severity;
import com.questrail.syslog.api.SyslogFormat;
import com.questrail.syslog.api.SyslogFormatException;
import com.questrail.syslog.config.SyslogFormatterConfig;
import com.questrail.syslog.identity.SyslogIdentity;
import com.questrail.syslog.model.Rfc5424Message;
import com.questrail.syslog.model.Rfc5424NumericMessage;
import com.questrail.syslog.time.SystemWallClock;
import com.questrail.syslog.time.WallClock;

import java.io.OutputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Formatter5424
 * -----------------------------------------------------------------------------
 * Renders events in the structured syslog format (RFC 5424).
 *
 * <pre>
 *   &lt;PRI&gt;1 TIMESTAMP HOSTNAME APP-NAME PROCID MSGID STRUCTURED-DATA MSG
 * </pre>
 *
 * <ul>
 *   <li>VERSION is always {@code 1} and follows the PRI bracket directly</li>
 *   <li>TIMESTAMP is RFC 3339 UTC, floored to microseconds</li>
 *   <li>An absent hostname is written as {@code localhost}. RFC 3164 omits the
 *       field instead; the two formats intentionally differ here</li>
 *   <li>MSGID is normalized by {@link MessageIds}</li>
 *   <li>STRUCTURED-DATA is produced by {@link StructuredDataEncoder}</li>
 * </ul>
 *
 * <p>The canonical payload is {@link Rfc5424Message}. A numeric MSGID
 * ({@link Rfc5424NumericMessage}) is converted to its decimal string and
 * delegated, either through {@link #format(OutputStream, Severity, Rfc5424NumericMessage)}
 * or the {@link #numericMessageIds()} view.</p>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 */
public final class Formatter5424 implements SyslogFormat<Rfc5424Message>
{
    static final String DEFAULT_HOSTNAME = "localhost";

    private static final String VERSION = "1";

    private final Facility facility;
    private final String hostname;
    private final String process;
    private final long pid;
    private final StructuredDataEncoder structuredDataEncoder;
    private final WallClock clock;

    private Formatter5424(Builder b) {
        this.facility = b.facility;
        this.hostname = b.hostname;
        this.process = b.process;
        this.pid = b.pid;
        this.structuredDataEncoder = b.structuredDataEncoder;
        this.clock = b.clock;
    }

    /**
     * Builds a formatter from discovered process identity and formatter configuration.
     */
    public static Formatter5424 create(SyslogIdentity identity, SyslogFormatterConfig config) {
        Objects.requireNonNull(config, "config");
        return builder()
                .withIdentity(identity)
                .withFacility(config.facility())
                .withStructuredDataEscaping(config.structuredDataEscaping())
                .withClock(config.clock())
                .build();
    }

    @Override
    public void format(OutputStream sink, Severity severity, Rfc5424Message message) throws SyslogFormatException {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");

        String line = '<' + Integer.toString(PriorityEncoder.encode(severity, facility)) + '>' + VERSION
                + ' ' + SyslogTimestamps.rfc5424(clock.now())
                + ' ' + (hostname != null ? hostname : DEFAULT_HOSTNAME)
                + ' ' + process
                + ' ' + pid
                + ' ' + MessageIds.normalize(message.messageId())
                + ' ' + structuredDataEncoder.encode(message.structuredData())
                + ' ' + message.message();

        LineWriter.write(sink, line, "RFC 5424");
    }

    /**
     * Formats a message whose MSGID is numeric; output is identical to passing
     * the decimal string form.
     */
    public void format(OutputStream sink, Severity severity, Rfc5424NumericMessage message)
            throws SyslogFormatException {
        Objects.requireNonNull(message, "message");
        format(sink, severity, message.toMessage());
    }

    /**
     * Returns a view of this formatter accepting numeric MSGIDs, including the
     * severity-named operations.
     */
    public SyslogFormat<Rfc5424NumericMessage> numericMessageIds() {
        return this::format;
    }

    public Facility facility() {
        return facility;
    }

    public Optional<String> hostname() {
        return Optional.ofNullable(hostname);
    }

    public String process() {
        return process;
    }

    public long pid() {
        return pid;
    }

    public StructuredDataEncoder.Escaping structuredDataEscaping() {
        return structuredDataEncoder.escaping();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Formatter5424[facility=" + facility + ", hostname=" + hostname
                + ", process=" + process + ", pid=" + pid
                + ", escaping=" + structuredDataEncoder.escaping() + "]";
    }

    public static final class Builder {
        private Facility facility = Facility.USER;
        private String hostname;
        private String process = "";
        private long pid;
        private StructuredDataEncoder structuredDataEncoder = StructuredDataEncoder.permissive();
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withIdentity(SyslogIdentity identity) {
            Objects.requireNonNull(identity, "identity");
            this.hostname = identity.hostname().orElse(null);
            this.process = identity.process();
            this.pid = identity.pid();
            return this;
        }

        public Builder withFacility(Facility facility) {
            this.facility = Objects.requireNonNull(facility, "facility");
            return this;
        }

        /**
         * Sets the hostname; {@code null} writes {@code localhost}.
         */
        public Builder withHostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder withProcess(String process) {
            this.process = Objects.requireNonNull(process, "process");
            return this;
        }

        public Builder withPid(long pid) {
            this.pid = SyslogIdentity.checkPid(pid);
            return this;
        }

        public Builder withStructuredDataEscaping(StructuredDataEncoder.Escaping escaping) {
            this.structuredDataEncoder = StructuredDataEncoder.forEscaping(escaping);
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Formatter5424 build() {
            return new Formatter5424(this);
        }
    }
}
