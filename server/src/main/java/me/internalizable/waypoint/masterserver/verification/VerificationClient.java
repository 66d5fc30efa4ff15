package me.internalizable.waypoint.masterserver.verification;

import me.internalizable.waypoint.masterserver.crypto.PacketCipher;
import me.internalizable.waypoint.masterserver.crypto.PacketDecryptionException;
import me.internalizable.waypoint.masterserver.protocol.ChallengeCodec;
import me.internalizable.waypoint.masterserver.protocol.ChallengeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Proves that a game server controls the endpoint it claims.
 *
 * <p>Sends one sealed challenge from an ephemeral UDP port and waits for a
 * sealed response from exactly the target address and port. Datagrams from
 * any other source, datagrams that fail authentication and datagrams that
 * are not a matching response are dropped without completing the attempt.
 * There is no retry; a caller wanting another attempt creates a new client.</p>
 *
 * <p>The client owns its socket. {@link #close()} releases it and may be
 * called any number of times, before or after a response.</p>
 */
public class VerificationClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(VerificationClient.class);

    public static final int MIN_PORT = 0;
    public static final int MAX_PORT = 65535;

    private static final int MAX_DATAGRAM_SIZE = 1600;

    private final String host;
    private final int port;
    private final PacketCipher cipher;
    private final long uid;
    private final Executor receiveExecutor;

    private final AtomicReference<VerificationState> state = new AtomicReference<>(VerificationState.IDLE);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<Integer> challengeFuture = new CompletableFuture<>();

    private volatile VerificationOutcome outcome = VerificationOutcome.PENDING;
    private volatile DatagramSocket socket;
    private volatile InetSocketAddress target;

    /**
     * Create a verification client.
     *
     * @param host target address
     * @param port target port
     * @param cipher cipher keyed with the listing's shared secret
     * @param uid identifier sent in the challenge and expected back
     * @param receiveExecutor executor running the receive loop
     */
    public VerificationClient(
            @Nonnull String host,
            int port,
            @Nonnull PacketCipher cipher,
            long uid,
            @Nonnull Executor receiveExecutor) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.uid = uid;
        this.receiveExecutor = Objects.requireNonNull(receiveExecutor, "receiveExecutor");
    }

    /**
     * Send the challenge and start listening for the response.
     *
     * <p>The returned future completes with the server's challenge value once a
     * matching response arrives, fails if the challenge could not be sent, and
     * is cancelled if the client is closed first.</p>
     *
     * @return future completing with the challenge value
     * @throws IllegalStateException if already connected
     */
    @Nonnull
    public CompletableFuture<Integer> connect() {
        if (!state.compareAndSet(VerificationState.IDLE, VerificationState.CONNECTING)) {
            throw new IllegalStateException("Verification client already used (state " + state.get() + ")");
        }

        if (port < MIN_PORT || port > MAX_PORT) {
            LOGGER.error("Port out of valid range: {} for {}", port, host);
            fail(new IllegalArgumentException("Port out of valid range: " + port));
            return challengeFuture;
        }

        try {
            target = new InetSocketAddress(InetAddress.getByName(host), port);
            socket = new DatagramSocket(0);

            byte[] packet = cipher.seal(ChallengeCodec.encodeChallenge(uid));

            if (!state.compareAndSet(VerificationState.CONNECTING, VerificationState.AWAITING_RESPONSE)) {
                // closed while connecting
                releaseSocket();
                return challengeFuture;
            }
            receiveExecutor.execute(this::receiveLoop);
            socket.send(new DatagramPacket(packet, packet.length, target));

            LOGGER.debug("Sent challenge to {} from local port {}", target, socket.getLocalPort());
        } catch (IOException e) {
            LOGGER.debug("Failed to send challenge to {}:{}: {}", host, port, e.getMessage());
            fail(e);
        }

        return challengeFuture;
    }

    private void receiveLoop() {
        byte[] buffer = new byte[MAX_DATAGRAM_SIZE];
        DatagramSocket receiveSocket = socket;

        while (state.get() == VerificationState.AWAITING_RESPONSE) {
            DatagramPacket datagram = new DatagramPacket(buffer, buffer.length);
            try {
                receiveSocket.receive(datagram);
            } catch (IOException e) {
                if (state.get() == VerificationState.AWAITING_RESPONSE) {
                    LOGGER.debug("Receive failed for {}: {}", target, e.getMessage());
                    fail(e);
                }
                return;
            }
            handleDatagram(datagram);
        }
    }

    private void handleDatagram(DatagramPacket datagram) {
        if (!isFromTarget(datagram)) {
            LOGGER.debug("Ignoring datagram from {}:{} (expected {})",
                    datagram.getAddress(), datagram.getPort(), target);
            return;
        }

        byte[] plaintext;
        try {
            plaintext = cipher.open(datagram.getData(), datagram.getOffset(), datagram.getLength());
        } catch (PacketDecryptionException e) {
            LOGGER.debug("Dropping datagram from {}: {}", target, e.getMessage());
            return;
        }

        ChallengeResponse response = ChallengeCodec.decodeResponse(plaintext, uid);
        if (response == null) {
            LOGGER.debug("Dropping non-matching response from {}", target);
            return;
        }

        if (state.compareAndSet(VerificationState.AWAITING_RESPONSE, VerificationState.VERIFIED)) {
            outcome = VerificationOutcome.SUCCEEDED;
            releaseSocket();
            challengeFuture.complete(response.challenge());
            LOGGER.debug("Endpoint {} verified (challenge {})", target, response.challenge());
        }
    }

    private boolean isFromTarget(DatagramPacket datagram) {
        InetSocketAddress expected = target;
        return expected != null
                && datagram.getPort() == expected.getPort()
                && expected.getAddress().equals(datagram.getAddress());
    }

    private void fail(Throwable cause) {
        VerificationState previous = state.getAndUpdate(s -> s.isTerminal() ? s : VerificationState.CLOSED);
        if (previous.isTerminal()) {
            return;
        }
        outcome = VerificationOutcome.FAILED;
        releaseSocket();
        challengeFuture.completeExceptionally(cause);
    }

    /**
     * Close the client after the caller gave up waiting.
     *
     * <p>Records a timed-out outcome unless a response already arrived.</p>
     */
    public void expire() {
        if (outcome == VerificationOutcome.PENDING) {
            outcome = VerificationOutcome.TIMED_OUT;
        }
        close();
    }

    /**
     * Release the socket. Idempotent.
     *
     * <p>A response arriving after this call is never delivered.</p>
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }

        VerificationState previous = state.getAndUpdate(s -> s == VerificationState.VERIFIED ? s : VerificationState.CLOSED);
        if (previous != VerificationState.VERIFIED && outcome == VerificationOutcome.PENDING) {
            outcome = VerificationOutcome.FAILED;
        }
        releaseSocket();
        challengeFuture.cancel(false);
    }

    private void releaseSocket() {
        DatagramSocket current = socket;
        if (current != null && !current.isClosed()) {
            current.close();
        }
    }

    // ==================== Queries ====================

    /**
     * Get the current state.
     *
     * @return verification state
     */
    @Nonnull
    public VerificationState getState() {
        return state.get();
    }

    /**
     * Get the outcome so far.
     *
     * @return verification outcome
     */
    @Nonnull
    public VerificationOutcome getOutcome() {
        return outcome;
    }

    /**
     * Get the local port the challenge was sent from.
     *
     * @return local port, or -1 before the socket is bound
     */
    public int getLocalPort() {
        DatagramSocket current = socket;
        return current != null ? current.getLocalPort() : -1;
    }

    /**
     * Get the resolved target endpoint.
     *
     * @return target, or null before {@link #connect()}
     */
    @Nullable
    public InetSocketAddress getTarget() {
        return target;
    }

    /**
     * Check if the socket has been released.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        DatagramSocket current = socket;
        return current == null ? state.get().isTerminal() : current.isClosed();
    }
}
