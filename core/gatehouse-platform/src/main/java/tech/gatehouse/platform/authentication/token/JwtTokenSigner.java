package tech.gatehouse.platform.authentication.token;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTAuthContextInfo;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonArray;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authentication.AuthConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * RS256 access token signer backed by SmallRye JWT.
 *
 * Supports two key sources:
 * 1. File-based keys (production) - PEM files from gatehouse.auth.jwt.*-key-path
 * 2. Generated keys (development) - a fresh RSA key pair per process
 */
@ApplicationScoped
public class JwtTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(JwtTokenSigner.class);
    private static final int KEY_SIZE = 2048;

    // Widens the parser's own wall-clock checks; expiry is decided against the injected clock.
    private static final int PARSER_TIME_SLACK_SECS = Integer.MAX_VALUE / 4;

    static final String CLAIM_JTI = "jti";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_EMAIL_VERIFIED = "email_verified";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_PERMISSIONS = "permissions";

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    private String issuer;
    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    public JwtTokenSigner() {
    }

    JwtTokenSigner(String issuer, KeyPair keyPair, Clock clock) {
        this.issuer = issuer;
        this.clock = clock;
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
        this.keyId = keyIdOf(publicKey);
    }

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        this.issuer = jwt.issuer();
        try {
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                loadKeys(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
            } else {
                KeyPair pair = generateKeyPair();
                this.privateKey = (RSAPrivateKey) pair.getPrivate();
                this.publicKey = (RSAPublicKey) pair.getPublic();
                LOG.warn("Using generated JWT keys. Configure gatehouse.auth.jwt.private-key-path and "
                    + "gatehouse.auth.jwt.public-key-path for production.");
            }
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
        this.keyId = keyIdOf(publicKey);
        LOG.infof("JWT signer initialized with issuer %s and key ID %s", issuer, keyId);
    }

    @Override
    public String sign(AccessTokenClaims claims) {
        JwtClaimsBuilder builder = Jwt.issuer(issuer)
            .subject(claims.subject())
            .claim(CLAIM_JTI, claims.tokenId())
            .claim(CLAIM_EMAIL_VERIFIED, claims.emailVerified())
            .claim(CLAIM_ROLES, claims.roles())
            .claim(CLAIM_PERMISSIONS, claims.permissions())
            .issuedAt(claims.issuedAt())
            .expiresAt(claims.expiresAt());

        if (claims.email() != null) {
            builder.claim(CLAIM_EMAIL, claims.email());
        }
        if (claims.name() != null) {
            builder.claim(CLAIM_NAME, claims.name());
        }

        return builder.jws()
            .keyId(keyId)
            .sign(privateKey);
    }

    @Override
    public Optional<AccessTokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            JWTAuthContextInfo context = new JWTAuthContextInfo(publicKey, issuer);
            context.setExpGracePeriodSecs(PARSER_TIME_SLACK_SECS);
            context.setClockSkew(PARSER_TIME_SLACK_SECS);
            JWTParser parser = new DefaultJWTParser(context);
            JsonWebToken jwt = parser.parse(token);

            if (!issuer.equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", issuer, jwt.getIssuer());
                return Optional.empty();
            }
            if (!Instant.ofEpochSecond(jwt.getExpirationTime()).isAfter(clock.instant())) {
                LOG.debug("Token expired");
                return Optional.empty();
            }

            return Optional.of(new AccessTokenClaims(
                stringClaim(jwt, CLAIM_JTI),
                jwt.getSubject(),
                stringClaim(jwt, CLAIM_EMAIL),
                stringClaim(jwt, CLAIM_NAME),
                booleanClaim(jwt, CLAIM_EMAIL_VERIFIED),
                stringSetClaim(jwt, CLAIM_ROLES),
                stringSetClaim(jwt, CLAIM_PERMISSIONS),
                Instant.ofEpochSecond(jwt.getIssuedAtTime()),
                Instant.ofEpochSecond(jwt.getExpirationTime())
            ));
        } catch (Exception e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    public String getIssuer() {
        return issuer;
    }

    public String getKeyId() {
        return keyId;
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    static KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        return keyGen.generateKeyPair();
    }

    private void loadKeys(Path privateKeyFile, Path publicKeyFile) throws IOException, GeneralSecurityException {
        LOG.infof("Loading JWT keys from %s and %s", privateKeyFile, publicKeyFile);
        byte[] privateKeyBytes = parsePem(Files.readString(privateKeyFile, StandardCharsets.US_ASCII), "PRIVATE KEY");
        byte[] publicKeyBytes = parsePem(Files.readString(publicKeyFile, StandardCharsets.US_ASCII), "PUBLIC KEY");

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
    }

    static byte[] parsePem(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    static String keyIdOf(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
    }

    private static String stringClaim(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        if (value == null) {
            return null;
        }
        if (value instanceof JsonString json) {
            return json.getString();
        }
        return value.toString();
    }

    private static boolean booleanClaim(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof JsonValue json) {
            return json.getValueType() == JsonValue.ValueType.TRUE;
        }
        return false;
    }

    private static Set<String> stringSetClaim(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof JsonArray array) {
            for (JsonValue element : array) {
                if (element instanceof JsonString s) {
                    result.add(s.getString());
                }
            }
        } else if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        }
        return result;
    }
}
