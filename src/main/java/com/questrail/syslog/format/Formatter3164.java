package com.questrail.syslog.format;

import com.questrail.syslog.api.Facility;
import com.questrail.syslog.api.Severity;
import com.questrail.syslog.api.SyslogFormat;
import com.questrail.syslog.api.SyslogFormatException;
import com.questrail.syslog.config.SyslogFormatterConfig;
import com.questrail.syslog.identity.SyslogIdentity;
import com.questrail.syslog.time.SystemWallClock;
import com.questrail.syslog.time.WallClock;

import java.io.OutputStream;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;

/**
 * Formatter3164
 * -----------------------------------------------------------------------------
 * Renders events in the BSD syslog format (RFC 3164).
 *
 * <pre>
 *   &lt;PRI&gt;Mmm dd hh:mm:ss HOSTNAME PROCESS[PID]: MESSAGE
 *   &lt;PRI&gt;Mmm dd hh:mm:ss PROCESS[PID]: MESSAGE          (no hostname)
 * </pre>
 *
 * <p>An absent hostname is a legitimate permanent state: the field and its
 * trailing space are omitted.</p>
 *
 * <h2>Timestamp zone</h2>
 * <p>RFC 3164 timestamps are local wall-clock time, but which zone counts as
 * "local" is an explicit setting rather than something read from the platform. The timestamp
 * is rendered in {@link #zone()}, which defaults to UTC. Use
 * {@link Builder#withLocalTime()} (or {@code rfc3164.timezone=local}) to render
 * in the JVM default zone, or {@link Builder#withZone(ZoneId)} for any other.</p>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 */
public final class Formatter3164 implements SyslogFormat<Object>
{
    private final Facility facility;
    private final String hostname;
    private final String process;
    private final long pid;
    private final ZoneId zone;
    private final WallClock clock;

    private Formatter3164(Builder b) {
        this.facility = b.facility;
        this.hostname = b.hostname;
        this.process = b.process;
        this.pid = b.pid;
        this.zone = b.zone;
        this.clock = b.clock;
    }

    /**
     * Builds a formatter from discovered process identity and formatter configuration.
     */
    public static Formatter3164 create(SyslogIdentity identity, SyslogFormatterConfig config) {
        Objects.requireNonNull(config, "config");
        return builder()
                .withIdentity(identity)
                .withFacility(config.facility())
                .withZone(config.rfc3164Zone())
                .withClock(config.clock())
                .build();
    }

    @Override
    public void format(OutputStream sink, Severity severity, Object message) throws SyslogFormatException {
        Objects.requireNonNull(severity, "severity");

        StringBuilder line = new StringBuilder(64)
                .append('<').append(PriorityEncoder.encode(severity, facility)).append('>')
                .append(SyslogTimestamps.rfc3164(clock.now(), zone))
                .append(' ');
        if (hostname != null) {
            line.append(hostname).append(' ');
        }
        line.append(process).append('[').append(pid).append("]: ")
                .append(message);

        LineWriter.write(sink, line, "RFC 3164");
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

    public ZoneId zone() {
        return zone;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Formatter3164[facility=" + facility + ", hostname=" + hostname
                + ", process=" + process + ", pid=" + pid + ", zone=" + zone + "]";
    }

    public static final class Builder {
        private Facility facility = Facility.USER;
        private String hostname;
        private String process = "";
        private long pid;
        private ZoneId zone = ZoneOffset.UTC;
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
         * Sets the hostname; {@code null} omits the HOSTNAME field.
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

        public Builder withZone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        /**
         * Renders timestamps in the JVM's default zone instead of UTC.
         */
        public Builder withLocalTime() {
            return withZone(ZoneId.systemDefault());
        }

        public Builder withClock(WallClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Formatter3164 build() {
            return new Formatter3164(this);
        }
    }
}
