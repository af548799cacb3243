/*
 * Copyright by the original author or authors.
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.escrowj.utils;

import com.google.common.util.concurrent.CycleDetectingLockFactory;
import org.junit.After;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ThreadingTest {

    @After
    public void tearDown() {
        Threading.throwOnLockCycles();
    }

    @Test
    public void lockCyclesAreDetected() {
        assertEquals(CycleDetectingLockFactory.Policies.THROW, Threading.getPolicy());
        ReentrantLock first = Threading.lock("first");
        ReentrantLock second = Threading.lock("second");
        first.lock();
        second.lock();
        second.unlock();
        first.unlock();

        second.lock();
        try {
            first.lock();
            fail();
        } catch (CycleDetectingLockFactory.PotentialDeadlockException e) {
        } finally {
            second.unlock();
        }
    }

    @Test
    public void userThreadRunsTasksInOrder() {
        final List<Integer> ran = new CopyOnWriteArrayList<>();
        final AtomicReference<Thread> thread = new AtomicReference<>();
        for (int i = 0; i < 5; i++) {
            final int n = i;
            Threading.USER_THREAD.execute(new Runnable() {
                @Override
                public void run() {
                    thread.set(Thread.currentThread());
                    ran.add(n);
                }
            });
        }
        Threading.waitForUserCode();
        assertEquals(5, ran.size());
        for (int i = 0; i < 5; i++)
            assertEquals(i, (int) ran.get(i));
        assertNotEquals(Thread.currentThread(), thread.get());
        assertEquals("escrowj user thread", thread.get().getName());
    }

    @Test
    public void removeListenerRegistration() {
        Runnable a = new Runnable() {
            @Override
            public void run() {
            }
        };
        Runnable b = new Runnable() {
            @Override
            public void run() {
            }
        };
        List<ListenerRegistration<Runnable>> list = new CopyOnWriteArrayList<>();
        list.add(new ListenerRegistration<>(a, Threading.SAME_THREAD));
        list.add(new ListenerRegistration<>(b, Threading.USER_THREAD));
        assertTrue(ListenerRegistration.removeFromList(a, list));
        assertFalse(ListenerRegistration.removeFromList(a, list));
        assertEquals(1, list.size());
        assertEquals(b, list.get(0).listener);
    }
}
