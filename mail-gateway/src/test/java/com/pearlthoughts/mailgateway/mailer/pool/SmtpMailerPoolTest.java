package com.pearlthoughts.mailgateway.mailer.pool;

import com.pearlthoughts.mailgateway.mailer.DeliveryReceipt;
import com.pearlthoughts.mailgateway.mailer.MailMessage;
import com.pearlthoughts.mailgateway.mailer.PoolStats;
import com.pearlthoughts.mailgateway.mailer.TransportException;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SmtpMailerPoolTest {

    @Mock
    private RelayConnector connector;

    private final List<Transport> openedTransports = new ArrayList<>();

    @BeforeEach
    void setUp() throws MessagingException {
        lenient().when(connector.getSession()).thenReturn(Session.getInstance(new Properties()));
        lenient().when(connector.connect()).thenAnswer(invocation -> newTransport());
    }

    @Test
    void testDeliver_AssignsMessageIdAndReusesConnection() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 2, 100, 1000);

        DeliveryReceipt first = pool.deliver(createMessage("a@example.com"));
        DeliveryReceipt second = pool.deliver(createMessage("b@example.com"));

        assertNotNull(first.getMessageId());
        assertTrue(first.getMessageId().startsWith("<"));
        assertNotEquals(first.getMessageId(), second.getMessageId());
        verify(connector, times(1)).connect();
        verify(openedTransports.get(0), times(2)).sendMessage(any(MimeMessage.class), any(Address[].class));

        PoolStats stats = pool.getStats();
        assertEquals(1, stats.getOpenConnections());
        assertEquals(1, stats.getIdleConnections());
        assertEquals(2, stats.getDeliveredMessages());
    }

    @Test
    void testDeliver_RetiresConnectionAfterMaxMessages() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 2, 1000);

        pool.deliver(createMessage("a@example.com"));
        pool.deliver(createMessage("b@example.com"));
        pool.deliver(createMessage("c@example.com"));

        verify(connector, times(2)).connect();
        verify(openedTransports.get(0)).close();
        verify(openedTransports.get(1), never()).close();
        assertEquals(1, pool.getStats().getOpenConnections());
    }

    @Test
    void testDeliver_TransportFailureRetiresConnection() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 1000);
        pool.deliver(createMessage("a@example.com"));
        Transport broken = openedTransports.get(0);
        doThrow(new MessagingException("Connection reset"))
                .when(broken).sendMessage(any(MimeMessage.class), any(Address[].class));

        TransportException e = assertThrows(TransportException.class,
                () -> pool.deliver(createMessage("b@example.com")));

        assertEquals("Connection reset", e.getMessage());
        assertTrue(e.isTransientFailure());
        verify(broken).close();
        assertEquals(0, pool.getStats().getOpenConnections());
        assertEquals(1, pool.getStats().getFailedDeliveries());

        pool.deliver(createMessage("c@example.com"));
        verify(connector, times(2)).connect();
    }

    @Test
    void testDeliver_RejectedRecipientKeepsConnection() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 1000);
        pool.deliver(createMessage("a@example.com"));
        Transport transport = openedTransports.get(0);
        doThrow(new SendFailedException("Invalid Addresses"))
                .when(transport).sendMessage(any(MimeMessage.class), any(Address[].class));

        assertThrows(TransportException.class, () -> pool.deliver(createMessage("nobody@example.com")));

        verify(transport, never()).close();
        assertEquals(1, pool.getStats().getIdleConnections());
        verify(connector, times(1)).connect();
    }

    @Test
    void testDeliver_ReplacesDisconnectedIdleConnection() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 1000);
        pool.deliver(createMessage("a@example.com"));
        Transport dropped = openedTransports.get(0);
        when(dropped.isConnected()).thenReturn(false);

        pool.deliver(createMessage("b@example.com"));

        verify(connector, times(2)).connect();
        verify(dropped).close();
        verify(dropped, times(1)).sendMessage(any(MimeMessage.class), any(Address[].class));
    }

    @Test
    void testDeliver_ConnectionRefusedReleasesSlot() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 100);
        doThrow(new MessagingException("Couldn't connect to host, port: stalwart, 587"))
                .doAnswer(invocation -> newTransport())
                .when(connector).connect();

        TransportException e = assertThrows(TransportException.class,
                () -> pool.deliver(createMessage("a@example.com")));
        assertTrue(e.getMessage().startsWith("Couldn't connect to host"));

        // the single slot must be free again
        DeliveryReceipt receipt = pool.deliver(createMessage("a@example.com"));
        assertNotNull(receipt.getMessageId());
    }

    @Test
    void testDeliver_TimesOutWhenPoolIsExhausted() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 100);
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        doAnswer(invocation -> {
            Transport transport = newTransport();
            doAnswer(send -> {
                sending.countDown();
                finish.await(5, TimeUnit.SECONDS);
                return null;
            }).when(transport).sendMessage(any(MimeMessage.class), any(Address[].class));
            return transport;
        }).when(connector).connect();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<DeliveryReceipt> slow = executor.submit(() -> pool.deliver(createMessage("a@example.com")));
            assertTrue(sending.await(5, TimeUnit.SECONDS));

            TransportException e = assertThrows(TransportException.class,
                    () -> pool.deliver(createMessage("b@example.com")));
            assertEquals("Timed out after 100 ms waiting for a relay connection", e.getMessage());
            assertTrue(e.isTransientFailure());

            finish.countDown();
            assertNotNull(slow.get(5, TimeUnit.SECONDS).getMessageId());
        } finally {
            finish.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testDeliver_ConcurrentCallersNeverExceedPoolSize() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 2, 100, 5000);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        doAnswer(invocation -> {
            Transport transport = newTransport();
            doAnswer(send -> {
                int current = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(current, Math::max);
                Thread.sleep(10);
                inFlight.decrementAndGet();
                return null;
            }).when(transport).sendMessage(any(MimeMessage.class), any(Address[].class));
            return transport;
        }).when(connector).connect();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<DeliveryReceipt>> futures = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                String to = "user" + i + "@example.com";
                futures.add(executor.submit(() -> pool.deliver(createMessage(to))));
            }
            for (Future<DeliveryReceipt> future : futures) {
                assertNotNull(future.get(10, TimeUnit.SECONDS).getMessageId());
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(maxInFlight.get() <= 2);
        assertTrue(pool.getStats().getOpenConnections() <= 2);
        assertEquals(24, pool.getStats().getDeliveredMessages());
    }

    @Test
    void testHealthCheck_OpensAndClosesDedicatedConnection() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 1000);

        pool.healthCheck();

        verify(connector).connect();
        verify(openedTransports.get(0)).close();
        assertEquals(0, pool.getStats().getOpenConnections());
    }

    @Test
    void testHealthCheck_AuthenticationFailureIsPermanent() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 1, 100, 1000);
        doThrow(new AuthenticationFailedException("535 5.7.8 Authentication failed")).when(connector).connect();

        TransportException e = assertThrows(TransportException.class, pool::healthCheck);

        assertEquals("535 5.7.8 Authentication failed", e.getMessage());
        assertFalse(e.isTransientFailure());
    }

    @Test
    void testShutdown_ClosesIdleConnectionsAndRefusesDeliveries() throws Exception {
        SmtpMailerPool pool = new SmtpMailerPool(connector, 2, 100, 1000);
        pool.deliver(createMessage("a@example.com"));

        pool.shutdown();

        verify(openedTransports.get(0)).close();
        assertEquals(0, pool.getStats().getIdleConnections());
        TransportException e = assertThrows(TransportException.class,
                () -> pool.deliver(createMessage("b@example.com")));
        assertEquals("Mailer pool is shut down", e.getMessage());
    }

    @Test
    void testConstructor_RejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new SmtpMailerPool(connector, 0, 100, 1000));
        assertThrows(IllegalArgumentException.class, () -> new SmtpMailerPool(connector, 1, 0, 1000));
    }

    private Transport newTransport() {
        Transport transport = mock(Transport.class);
        lenient().when(transport.isConnected()).thenReturn(true);
        synchronized (openedTransports) {
            openedTransports.add(transport);
        }
        return transport;
    }

    private MailMessage createMessage(String to) {
        return MailMessage.builder()
                .from("sender@example.com")
                .to(List.of(to))
                .subject("Test Subject")
                .textBody("Test Body")
                .build();
    }
}
