package in.lockvault.infrastructure.persistence;

import in.lockvault.application.port.output.VaultRepository;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVaultRepositoryTest extends VaultRepositoryContract {

    @Override
    protected VaultRepository createRepository() {
        return new InMemoryVaultRepository();
    }

    @Test
    void concurrentWritersAreSerialized() throws InterruptedException {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    repository.inTransaction(tx -> {
                        tx.adjustTotalLocked(BigDecimal.ONE);
                        return null;
                    });
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(0, new BigDecimal(threads * perThread).compareTo(repository.readOnly(tx -> tx.totalLocked())));
    }
}
