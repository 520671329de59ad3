package org.metricshub.jail;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

public class CellGateTest {

	@Test
	public void testReentrant() {
		CellGate gate = new CellGate("g", 100);
		gate.acquire();
		gate.acquire();
		gate.release();
		assertTrue(gate.isBusy());
		gate.release();
		assertFalse(gate.isBusy());
	}

	@Test
	public void testTimeout() throws Exception {
		final CellGate gate = new CellGate("g", 100);
		final CountDownLatch held = new CountDownLatch(1);
		final CountDownLatch done = new CountDownLatch(1);
		Thread holder = new Thread(new Runnable() {
			@Override
			public void run() {
				gate.acquire();
				held.countDown();
				try {
					done.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				} finally {
					gate.release();
				}
			}
		});
		holder.start();
		assertTrue(held.await(5, TimeUnit.SECONDS));
		try {
			gate.acquire();
			fail("CellBusyException expected");
		} catch (CellBusyException e) {
			assertTrue(e.getMessage().contains("Cell[g] is busy"));
		} finally {
			done.countDown();
			holder.join();
		}
		gate.acquire();
		gate.release();
	}
}
