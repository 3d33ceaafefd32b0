package com.lumis.invoiceingest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class Fixtures {

    public static final String CUFE = "FE01200002679372-1-844-5000002025051500311570140020317481978892";
    public static final String QR_URL =
            "https://dgi-fep.mef.gob.pa/Consultas/FacturasPorQR?chFE=" + CUFE + "&iAmb=1&digestValue=abc";

    private Fixtures() {}

    /** A CUFE-shaped key that no other test uses, for tests sharing the in-memory database. */
    public static String uniqueCufe() {
        return "FE01200002679372-1-844-" + UUID.randomUUID().toString().replace("-", "");
    }

    public static String qrUrl(String cufe) {
        return "https://dgi-fep.mef.gob.pa/Consultas/FacturasPorQR?chFE=" + cufe + "&iAmb=1&digestValue=abc";
    }

    /** The standard confirmation page with its CUFE replaced. */
    public static String invoicePage(String fixture, String cufe) {
        return html(fixture).replace(CUFE, cufe);
    }

    public static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
