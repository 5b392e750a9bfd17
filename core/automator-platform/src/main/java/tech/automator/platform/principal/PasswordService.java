package tech.automator.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.wildfly.security.password.Password;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;
import tech.automator.platform.config.SecurityConfig;

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;

/**
 * Password hashing and verification using BCrypt via WildFly Elytron.
 *
 * Hashes are stored in Modular Crypt Format, which embeds the salt and cost factor,
 * so raising the configured cost never invalidates existing hashes.
 */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final String BCRYPT_ALGORITHM = BCryptPassword.ALGORITHM_BCRYPT;
    private static final int SALT_SIZE = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        Security.addProvider(WildFlyElytronPasswordProvider.getInstance());
    }

    @Inject
    SecurityConfig config;

    /**
     * Hash a password with a fresh random salt.
     *
     * @param plainPassword the plain text password
     * @return the hash in Modular Crypt Format
     * @throws PasswordHashingException if the password is empty or hashing fails
     */
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new PasswordHashingException("Password cannot be null or empty");
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);

            byte[] salt = new byte[SALT_SIZE];
            RANDOM.nextBytes(salt);

            IteratedSaltedPasswordAlgorithmSpec spec =
                new IteratedSaltedPasswordAlgorithmSpec(config.bcryptCost(), salt);
            Password password = factory.generatePassword(
                new EncryptablePasswordSpec(plainPassword.toCharArray(), spec));

            return ModularCrypt.encodeAsString(password);

        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new PasswordHashingException("Failed to hash password", e);
        }
    }

    /**
     * Verify a password against a stored hash.
     * A missing or malformed hash verifies as false rather than throwing.
     *
     * @return true if the password matches the hash
     */
    public boolean verify(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null || passwordHash.isEmpty()) {
            return false;
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);
            Password stored = factory.translate(ModularCrypt.decode(passwordHash));
            return factory.verify(stored, plainPassword.toCharArray());

        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.debugf("Stored password hash could not be decoded: %s", e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Check a new password against the configured length policy.
     */
    public boolean meetsPolicy(String plainPassword) {
        return plainPassword != null
            && plainPassword.length() >= config.passwordMinLength()
            && plainPassword.length() <= config.passwordMaxLength();
    }
}
