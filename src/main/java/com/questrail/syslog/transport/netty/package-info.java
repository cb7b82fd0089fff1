/**
 * Netty Adapter for Syslog Encoding
 * =============================================================================
 *
 * <p>Bridges a {@link com.questrail.syslog.api.SyslogFormat} into a Netty
 * outbound pipeline. The adapter produces framed bytes only; channel setup,
 * delivery and reconnection remain the caller's responsibility.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code ByteBuf}, {@code ChannelHandlerContext}) MUST NOT
 * escape this package. The formatters above it see only
 * {@link java.io.OutputStream}.
 */
package com.questrail.syslog.transport.netty;
