package com.questrail.syslog.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * SyslogIdentity
 * =============================================================================
 * The host and process identity written into syslog headers.
 *
 * <h2>Discovery</h2>
 * <p>
 * {@link #detect()} inspects the environment once. Call it at startup and pass
 * the result to the formatter factories; formatters never look it up on their own.
 * </p>
 *
 * <p>Discovery is best-effort and never fails:</p>
 * <ul>
 *   <li>hostname: local host name, or absent if it cannot be resolved</li>
 *   <li>process: file name of the running executable, or {@code ""}</li>
 *   <li>pid: the OS-reported process id</li>
 * </ul>
 */
public record SyslogIdentity(
    Optional<String> hostname,
    String process,
    long pid
) {
    private static final Logger log = LoggerFactory.getLogger(SyslogIdentity.class);

    /** PROCID is carried as an unsigned 32-bit value. */
    public static final long MAX_PID = 0xFFFF_FFFFL;

    public SyslogIdentity {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(process, "process");
        checkPid(pid);
    }

    public static SyslogIdentity of(String hostname, String process, long pid) {
        return new SyslogIdentity(Optional.ofNullable(hostname), process, pid);
    }

    /**
     * Discovers the local host and current process.
     */
    public static SyslogIdentity detect() {
        ProcessHandle self = ProcessHandle.current();

        SyslogIdentity identity = new SyslogIdentity(
                detectHostname(),
                detectProcessName(self),
                self.pid());

        log.debug("Detected syslog identity: hostname={}, process={}, pid={}",
                identity.hostname().orElse("<none>"), identity.process(), identity.pid());
        return identity;
    }

    /**
     * Validates a PROCID value.
     *
     * @throws IllegalArgumentException if {@code pid} is outside 0–{@value #MAX_PID}
     */
    public static long checkPid(long pid) {
        if (pid < 0 || pid > MAX_PID) {
            throw new IllegalArgumentException("pid must be in range 0–" + MAX_PID + " (was " + pid + ")");
        }
        return pid;
    }

    static Optional<String> detectHostname() {
        try {
            String name = InetAddress.getLocalHost().getHostName();
            return (name == null || name.isEmpty()) ? Optional.empty() : Optional.of(name);
        } catch (UnknownHostException | SecurityException e) {
            log.warn("Unable to resolve local hostname; HOSTNAME will be omitted", e);
            return Optional.empty();
        }
    }

    static String detectProcessName(ProcessHandle handle) {
        return handle.info().command()
                .map(SyslogIdentity::executableName)
                .orElseGet(() -> {
                    log.debug("Process command unavailable for pid {}; using empty process name", handle.pid());
                    return "";
                });
    }

    static String executableName(String command) {
        try {
            Path fileName = Path.of(command).getFileName();
            return fileName == null ? "" : fileName.toString();
        } catch (InvalidPathException e) {
            log.debug("Process command '{}' is not a valid path; using it verbatim", command);
            return command;
        }
    }
}
