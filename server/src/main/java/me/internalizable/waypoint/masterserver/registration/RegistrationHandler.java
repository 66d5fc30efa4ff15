package me.internalizable.waypoint.masterserver.registration;

import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.api.masterserver.RegistrationException;
import me.internalizable.waypoint.api.masterserver.VerificationTimeoutException;
import me.internalizable.waypoint.masterserver.crypto.PacketCipher;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ListingStore;
import me.internalizable.waypoint.masterserver.registry.RegistryEntry;
import me.internalizable.waypoint.masterserver.verification.VerificationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Validates, verifies and stores server registrations.
 *
 * <p>Each call makes exactly one verification attempt, raced against the
 * configured timeout. Nothing is written unless the endpoint answered. The
 * verification socket is released whichever way the race ends.</p>
 */
public class RegistrationHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistrationHandler.class);

    private final ListingStore store;
    private final ListingValidator validator;
    private final Executor receiveExecutor;
    private final Duration verificationTimeout;
    private final Duration listingTtl;
    private final long challengeUid;

    /**
     * Create a registration handler.
     *
     * @param store listing store
     * @param validator listing validator
     * @param receiveExecutor executor running verification receive loops
     * @param verificationTimeout how long to wait for a challenge response
     * @param listingTtl expiry of stored listings
     * @param challengeUid identifier sent in every challenge
     */
    public RegistrationHandler(
            @Nonnull ListingStore store,
            @Nonnull ListingValidator validator,
            @Nonnull Executor receiveExecutor,
            @Nonnull Duration verificationTimeout,
            @Nonnull Duration listingTtl,
            long challengeUid) {
        this.store = Objects.requireNonNull(store, "store");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.receiveExecutor = Objects.requireNonNull(receiveExecutor, "receiveExecutor");
        this.verificationTimeout = Objects.requireNonNull(verificationTimeout, "verificationTimeout");
        this.listingTtl = Objects.requireNonNull(listingTtl, "listingTtl");
        this.challengeUid = challengeUid;
    }

    /**
     * Register or refresh a listing.
     *
     * @param registration submitted registration
     * @return future completing with the outcome, or failing with a {@link RegistrationException}
     */
    @Nonnull
    public CompletableFuture<MasterServerAPI.RegistrationOutcome> register(
            @Nonnull MasterServerAPI.Registration registration) {
        Objects.requireNonNull(registration, "registration");

        RegistryEntry entry;
        try {
            entry = validator.validate(registration);
        } catch (RegistrationException e) {
            LOGGER.debug("Rejected registration from {}: {}", registration.getIp(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        EndpointKey endpoint = entry.endpoint();
        VerificationClient client = createClient(entry);

        return client.connect()
                .orTimeout(verificationTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((challenge, error) -> {
                    if (error != null) {
                        client.expire();
                    } else {
                        client.close();
                    }
                })
                .handle((challenge, error) -> {
                    if (error != null) {
                        throw translate(endpoint, error);
                    }
                    return store(entry);
                });
    }

    VerificationClient createClient(RegistryEntry entry) {
        return new VerificationClient(
                entry.endpoint().ip(),
                entry.endpoint().port(),
                PacketCipher.fromBase64(entry.secret()),
                challengeUid,
                receiveExecutor
        );
    }

    private MasterServerAPI.RegistrationOutcome store(RegistryEntry verified) {
        Listing listing = verified.listing();
        String token = listing.hidden() ? resolveToken(listing.endpoint()) : null;

        store.put(new RegistryEntry(listing.withToken(token), verified.secret()), listingTtl);
        LOGGER.info("Registered server '{}' at {} (hidden={})", listing.name(), listing.endpoint(), listing.hidden());

        return new RegistrationResult(token, listing.endpoint().ip(), listing.endpoint().port());
    }

    private String resolveToken(EndpointKey endpoint) {
        Listing existing = store.getByEndpoint(endpoint.ip(), endpoint.port());
        if (existing != null && existing.token() != null) {
            return existing.token();
        }
        return UUID.randomUUID().toString();
    }

    private RegistrationException translate(EndpointKey endpoint, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;

        if (cause instanceof TimeoutException) {
            LOGGER.info("Verification of {} timed out after {} ms", endpoint, verificationTimeout.toMillis());
            return new VerificationTimeoutException();
        }
        if (cause instanceof RegistrationException registrationException) {
            return registrationException;
        }
        if (cause instanceof CancellationException) {
            return new RegistrationException("Server verification was cancelled.", cause);
        }

        LOGGER.warn("Verification of {} failed: {}", endpoint, cause.getMessage());
        return new RegistrationException("Server verification failed.", cause);
    }

    /**
     * Outcome of a successful registration.
     *
     * @param token stable token of a hidden listing, null for public ones
     * @param ip registered address
     * @param port registered port
     */
    public record RegistrationResult(@Nullable String token, @Nonnull String ip, int port)
            implements MasterServerAPI.RegistrationOutcome {

        @Override
        @Nullable
        public String getToken() {
            return token;
        }

        @Override
        @Nonnull
        public String getIp() {
            return ip;
        }

        @Override
        public int getPort() {
            return port;
        }
    }
}
