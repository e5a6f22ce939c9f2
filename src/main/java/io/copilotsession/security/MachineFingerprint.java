package io.copilotsession.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Host name, local user and OS family of the current machine. The obfuscation keystream is the
 * SHA-256 digest of the three concatenated, so blobs only open on the machine that wrote them.
 */
public record MachineFingerprint(String hostName, String userName, String osFamily) {

    public static MachineFingerprint current() {
        return new MachineFingerprint(
                resolveHostName(),
                System.getProperty("user.name", ""),
                osFamily(System.getProperty("os.name", ""))
        );
    }

    public byte[] keystream() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest((hostName + userName + osFamily).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String osFamily(String osName) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return "Darwin";
        }
        if (os.contains("win")) {
            return "Windows";
        }
        if (os.contains("linux")) {
            return "Linux";
        }
        return osName == null ? "" : osName;
    }

    // Environment names stand in only when the resolver fails.
    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            if (fromEnv == null || fromEnv.isBlank()) {
                fromEnv = System.getenv("COMPUTERNAME");
            }
            if (fromEnv != null && !fromEnv.isBlank()) {
                return fromEnv.trim();
            }
            throw new IllegalStateException("Cannot resolve local host name", e);
        }
    }
}
