package autowarm.engine.store;

import autowarm.engine.model.Resource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcResourceRepositoryTest {

    private static final long ALICE = 1;
    private static final long BOB = 2;

    private static DurableStore store;
    private static JdbcResourceRepository repo;

    @BeforeAll
    static void setup() {
        store = TestStores.singleH2("test-resource-repo");
        repo = new JdbcResourceRepository(store);
    }

    @AfterAll
    static void teardown() {
        if (store != null)
            store.close();
    }

    @BeforeEach
    void cleanTables() {
        TestStores.clean(store);
        repo.save(new Resource(100, ALICE, "@alice", true, null));
        repo.save(new Resource(101, ALICE, "@alice_backup", false, null));
        repo.save(new Resource(200, BOB, "@bob", true, null));
    }

    @Test
    void findForOwnerReturnsOwnResource() {
        Resource found = repo.findForOwner(ALICE, 100).orElseThrow();

        assertEquals("@alice", found.handle());
        assertTrue(found.active());
        assertNotNull(found.createdAt());
    }

    @Test
    void resourceOfAnotherOwnerIsNotFound() {
        assertTrue(repo.findForOwner(ALICE, 200).isEmpty());
        assertTrue(repo.findForOwner(BOB, 100).isEmpty());
    }

    @Test
    void findByOwnerFiltersActive() {
        assertEquals(List.of(100L, 101L), repo.findByOwner(ALICE, false).stream().map(Resource::id).toList());
        assertEquals(List.of(100L), repo.findByOwner(ALICE, true).stream().map(Resource::id).toList());
        assertEquals(List.of(200L), repo.findByOwner(BOB, false).stream().map(Resource::id).toList());
    }

    @Test
    void updateOnlyTouchesOwnResource() {
        Resource renamed = repo.findForOwner(ALICE, 100).orElseThrow().withHandle("@alice_new");
        assertTrue(repo.update(ALICE, renamed));
        assertEquals("@alice_new", repo.findForOwner(ALICE, 100).orElseThrow().handle());

        // Alice cannot update Bob's resource by claiming it
        Resource hijack = new Resource(200, ALICE, "@mine_now", true, null);
        assertFalse(repo.update(ALICE, hijack));
        assertEquals("@bob", repo.findForOwner(BOB, 200).orElseThrow().handle());
    }

    @Test
    void updateCannotChangeOwner() {
        Resource moved = new Resource(100, BOB, "@alice", true, null);

        assertThrows(IllegalArgumentException.class, () -> repo.update(ALICE, moved));
    }

    @Test
    void deactivateIsTenantScoped() {
        assertFalse(repo.deactivate(ALICE, 200));
        assertTrue(repo.findForOwner(BOB, 200).orElseThrow().active());

        assertTrue(repo.deactivate(BOB, 200));
        assertFalse(repo.findForOwner(BOB, 200).orElseThrow().active());
    }

    @Test
    @DisplayName("Owners working in parallel never reach each other's resources")
    void concurrentOwnersStayIsolated() throws Exception {
        int owners = 8;
        int rounds = 40;
        TestStores.clean(store);
        for (long owner = 1; owner <= owners; owner++) {
            repo.save(new Resource(owner * 1000 + 1, owner, "@u" + owner, true, null));
            repo.save(new Resource(owner * 1000 + 2, owner, "@u" + owner + "_spare", true, null));
        }

        ExecutorService pool = Executors.newFixedThreadPool(owners);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (long o = 1; o <= owners; o++) {
                long owner = o;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int round = 0; round < rounds; round++) {
                        long other = (owner + round) % owners + 1;
                        if (other == owner) {
                            other = owner % owners + 1;
                        }
                        long foreignId = other * 1000 + 1 + round % 2;

                        assertTrue(repo.findForOwner(owner, foreignId).isEmpty());
                        assertFalse(repo.update(owner, new Resource(foreignId, owner, "@stolen", true, null)));
                        assertFalse(repo.deactivate(owner, foreignId));

                        for (Resource r : repo.findByOwner(owner, false)) {
                            assertEquals(owner, r.ownerId());
                        }
                        Resource own = repo.findForOwner(owner, owner * 1000 + 1).orElseThrow();
                        assertEquals(owner, own.ownerId());
                        assertTrue(repo.update(owner, own.withHandle("@u" + owner + "_" + round)));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (long owner = 1; owner <= owners; owner++) {
            List<Resource> own = repo.findByOwner(owner, true);
            assertEquals(2, own.size(), "owner " + owner);
            for (Resource r : own) {
                assertEquals(owner, r.ownerId());
                assertTrue(r.handle().startsWith("@u" + owner), r.handle());
            }
        }
    }
}
