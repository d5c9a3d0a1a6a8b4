// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Runs the one-way calls for a single object, one at a time and in the order they were
 * submitted. The queue is drained by a single task on an executor; a thread that needs
 * the queue to be empty before proceeding (a two-way call to the same object) drains
 * it itself if the drain task has not started yet.
 */
final class SerialExecutionQueue {
	private static final Logger LOG = LoggerFactory.getLogger( SerialExecutionQueue.class );

	/**
	 * A queued call. Exactly one of the methods is called.
	 */
	interface Task {
		void run();

		/**
		 * Called instead of {@link #run()} when the queue is closed before the task
		 * runs.
		 */
		void discard();
	}


	private enum State {
		IDLE,
		SCHEDULED,
		RUNNING
	}


	private final Executor executor;
	private final int capacity;

	private final Lock lock = new ReentrantLock();
	private final Condition progress = lock.newCondition();

	private final ArrayDeque<Task> queue = new ArrayDeque<>();
	private State state = State.IDLE;
	private boolean drain_task_pending = false;
	private boolean closed = false;
	private long submitted = 0;
	private long completed = 0;


	/**
	 * @param executor		Executor for drain tasks. If null, the queue is drained on
	 * 						the submitting thread.
	 * @param capacity		Maximum number of tasks waiting to run.
	 */
	SerialExecutionQueue( @Nullable Executor executor, int capacity ) {
		if ( capacity < 1 ) throw new IllegalArgumentException( "Invalid capacity: " + capacity );

		this.executor = executor;
		this.capacity = capacity;
	}


	/**
	 * Add a task to the queue.
	 *
	 * @return		False if the queue is full or closed, in which case the task will
	 * 				never be run or discarded.
	 */
	boolean submit( @Nonnull Task task ) {
		boolean schedule = false;
		lock.lock();
		try {
			if ( closed || queue.size() >= capacity ) return false;

			queue.add( task );
			submitted++;
			if ( state == State.IDLE ) {
				state = State.SCHEDULED;
				if ( !drain_task_pending ) {
					drain_task_pending = true;
					schedule = true;
				}
			}
		}
		finally {
			lock.unlock();
		}

		if ( schedule ) scheduleDrain();
		return true;
	}


	/**
	 * Wait until every task submitted before this call has finished. If the drain has
	 * been scheduled but not started, the calling thread runs the tasks itself so that
	 * it cannot be left waiting behind its own pool.
	 */
	void awaitSubmitted() {
		lock.lock();
		try {
			final long target = submitted;
			while( completed < target && !closed ) {
				if ( state == State.SCHEDULED ) {
					state = State.RUNNING;
					lock.unlock();
					try {
						drain( target );
					}
					finally {
						lock.lock();
					}
				}
				else if ( state == State.RUNNING ) {
					progress.awaitUninterruptibly();
				}
				else {
					// IDLE with work outstanding means it was discarded by close()
					break;
				}
			}
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Stop accepting tasks and discard any that have not started.
	 */
	void close() {
		List<Task> discarded;
		lock.lock();
		try {
			if ( closed ) return;
			closed = true;

			discarded = new ArrayList<>( queue );
			queue.clear();
			progress.signalAll();
		}
		finally {
			lock.unlock();
		}

		for( Task task : discarded ) {
			try {
				task.discard();
			}
			catch( RuntimeException ex ) {
				LOG.warn( "Error discarding task: {}", task, ex );
			}
		}
	}


	int size() {
		lock.lock();
		try {
			return queue.size();
		}
		finally {
			lock.unlock();
		}
	}


	private void scheduleDrain() {
		if ( executor == null ) {
			runDrainTask();
			return;
		}

		try {
			executor.execute( this::runDrainTask );
		}
		catch( RejectedExecutionException ex ) {
			LOG.debug( "Executor rejected drain task, discarding queued calls" );
			lock.lock();
			try {
				drain_task_pending = false;
				if ( state == State.SCHEDULED ) state = State.IDLE;
			}
			finally {
				lock.unlock();
			}
			close();
		}
	}


	private void runDrainTask() {
		lock.lock();
		try {
			drain_task_pending = false;

			// Claimed by a waiting thread, which will reschedule if needed
			if ( state != State.SCHEDULED ) return;
			state = State.RUNNING;
		}
		finally {
			lock.unlock();
		}

		drain( Long.MAX_VALUE );
	}


	/**
	 * Run tasks until the queue is empty or the given number of tasks has completed.
	 * Must be called in the RUNNING state by the thread that set it.
	 */
	private void drain( long until_completed ) {
		while( true ) {
			Task task;
			boolean schedule = false;
			lock.lock();
			try {
				if ( completed >= until_completed && !queue.isEmpty() ) {
					// Hand the rest back to a pool task
					task = null;
					state = State.SCHEDULED;
					if ( !drain_task_pending ) {
						drain_task_pending = true;
						schedule = true;
					}
					progress.signalAll();
				}
				else {
					task = queue.poll();
					if ( task == null ) {
						state = State.IDLE;
						progress.signalAll();
						return;
					}
				}
			}
			finally {
				lock.unlock();
			}

			if ( task == null ) {
				if ( schedule ) scheduleDrain();
				return;
			}

			try {
				task.run();
			}
			catch( RuntimeException ex ) {
				LOG.warn( "Error running queued call: {}", task, ex );
			}

			lock.lock();
			try {
				completed++;
				progress.signalAll();
			}
			finally {
				lock.unlock();
			}
		}
	}
}
