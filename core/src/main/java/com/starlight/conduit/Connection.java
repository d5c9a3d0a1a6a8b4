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

import com.starlight.conduit.driver.DriverConnection;
import com.starlight.conduit.message.IMessage;
import com.starlight.conduit.message.SessionCloseIMessage;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;


/**
 * One driver connection belonging to a session.
 * <p>
 * Transactions and replies received on the connection are queued and consumed by the
 * single thread servicing the connection at the time: the caller waiting for a reply
 * on it, or a pool thread. Control messages never enter the queue.
 */
final class Connection {
	enum Direction {
		/** Carries calls this side makes. */
		OUTGOING,
		/** Carries calls the peer makes. */
		INCOMING
	}


	/** Queued once the connection closes, and left in place. */
	static final IMessage CLOSED = new SessionCloseIMessage( "connection closed" );


	private final ConduitSession session;
	private final DriverConnection driver_connection;
	private final Direction direction;
	private final int max_queued;

	private final BlockingQueue<IMessage> inbound = new LinkedBlockingQueue<>();

	// Whether a thread is servicing (or has been scheduled to service) the connection.
	// Guarded by the session's connection lock.
	boolean busy;

	private volatile boolean closed = false;


	Connection( @Nonnull ConduitSession session, @Nonnull DriverConnection driver_connection,
		@Nonnull Direction direction, int max_queued ) {

		this.session = session;
		this.driver_connection = driver_connection;
		this.direction = direction;
		this.max_queued = max_queued;
	}


	@Nonnull
	ConduitSession getSession() {
		return session;
	}

	@Nonnull
	Direction getDirection() {
		return direction;
	}

	@Nonnull
	DriverConnection getDriverConnection() {
		return driver_connection;
	}


	void send( @Nonnull IMessage message ) throws IOException {
		driver_connection.send( message );
	}


	/**
	 * Queue a received transaction or reply.
	 *
	 * @return		False if the queue is full.
	 */
	boolean enqueue( @Nonnull IMessage message ) {
		if ( inbound.size() >= max_queued ) return false;
		inbound.add( message );
		return true;
	}


	/**
	 * Wait for the next queued message. Returns {@link #CLOSED} once the connection
	 * has closed and everything before it has been consumed.
	 */
	@Nonnull
	IMessage take() {
		boolean interrupted = false;
		try {
			while( true ) {
				try {
					IMessage message = inbound.take();
					if ( message == CLOSED ) inbound.add( CLOSED );
					return message;
				}
				catch( InterruptedException ex ) {
					// No per-call cancellation: only shutdown ends the wait
					interrupted = true;
				}
			}
		}
		finally {
			if ( interrupted ) Thread.currentThread().interrupt();
		}
	}


	IMessage poll() {
		IMessage message = inbound.poll();
		if ( message == CLOSED ) inbound.add( CLOSED );
		return message;
	}


	IMessage poll( long timeout, TimeUnit unit ) throws InterruptedException {
		IMessage message = inbound.poll( timeout, unit );
		if ( message == CLOSED ) inbound.add( CLOSED );
		return message;
	}


	boolean hasQueued() {
		return !inbound.isEmpty();
	}


	boolean isOpen() {
		return !closed && driver_connection.isOpen();
	}


	/**
	 * Close the driver connection.
	 */
	void close() {
		driver_connection.close();
		markClosed();
	}


	/**
	 * Record that the connection is closed, waking any thread waiting on it.
	 *
	 * @return		True if this call performed the transition.
	 */
	boolean markClosed() {
		synchronized( this ) {
			if ( closed ) return false;
			closed = true;
		}
		inbound.add( CLOSED );
		return true;
	}


	@Override
	public String toString() {
		return "Connection{" +
			direction +
			", " + driver_connection.getRemoteAddressDescription() +
			( closed ? ", closed" : "" ) +
			'}';
	}
}
