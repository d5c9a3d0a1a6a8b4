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

import com.starlight.conduit.driver.CloseConnectionIndicator;
import com.starlight.conduit.driver.ConduitDriver;
import com.starlight.conduit.driver.DriverConnection;
import com.starlight.conduit.driver.InboundMessageHandler;
import com.starlight.conduit.driver.ProtocolVersions;
import com.starlight.conduit.message.IMessage;
import com.starlight.conduit.message.ReplyIMessage;
import com.starlight.conduit.message.SessionInitIMessage;
import com.starlight.conduit.message.SessionInitResponseIMessage;
import com.starlight.conduit.message.TransactIMessage;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;


/**
 * Accepts sessions from clients and services the calls they make on a pool of worker
 * threads. The thread count also sets how many connections each client opens for its
 * calls.
 * <p>
 * Lifecycle: {@link #bind(Endpoint) bind} one or more endpoints, set the
 * {@link #setRootObject root object}, {@link #start()} and eventually
 * {@link #shutdown()}. Handshakes arriving before the server starts are refused.
 */
public class ConduitServer {
	private static final Logger LOG = LoggerFactory.getLogger( ConduitServer.class );


	private enum State {
		NEW,
		STARTED,
		SHUT_DOWN
	}


	private final ConduitDriver driver;
	private final int oneway_capacity;

	// Identifies worker threads, which must not wait for a pool to terminate. Shared
	// by every server since thread groups are never reclaimed.
	private static final ThreadGroup WORKER_GROUP =
		new ThreadGroup( "conduit-server-worker" );

	private final ThreadPoolExecutor worker_pool;

	private final Lock sessions_lock = new ReentrantLock();
	private final Map<Long,ConduitSession> sessions = new HashMap<>();

	private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();

	private final Object max_threads_lock = new Object();
	private volatile int max_threads;

	private final Object root_lock = new Object();
	private LocalObject root_object;                // guarded by root_lock
	private boolean root_strong;                    // guarded by root_lock

	private final AtomicReference<State> state = new AtomicReference<>( State.NEW );
	private final CountDownLatch shutdown_latch = new CountDownLatch( 1 );


	private ConduitServer( @Nonnull ConduitDriver driver, int max_threads,
		int oneway_capacity ) {

		this.driver = driver;
		this.max_threads = max_threads;
		this.oneway_capacity = oneway_capacity;

		worker_pool = new ThreadPoolExecutor( max_threads, max_threads, 30,
			TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
			new DefaultThreadFactory( "conduit-server-worker", true, Thread.NORM_PRIORITY,
				WORKER_GROUP ) );
		worker_pool.allowCoreThreadTimeOut( true );
	}


	public static Builder newBuilder() {
		return new Builder();
	}


	/**
	 * Start listening on an endpoint. May be called more than once.
	 *
	 * @return		The endpoint actually bound, which differs from the argument when an
	 * 				INET endpoint asks for an ephemeral port.
	 *
	 * @throws UnsupportedOperationException	If the driver does not support the
	 * 										endpoint type.
	 */
	@Nonnull
	public Endpoint bind( @Nonnull Endpoint endpoint ) throws IOException {
		requireNonNull( endpoint );
		if ( state.get() == State.SHUT_DOWN ) {
			throw new IllegalStateException( "Server is shut down" );
		}
		if ( !driver.supports( endpoint.getType() ) ) {
			throw new UnsupportedOperationException( "Driver does not support " +
				endpoint.getType() + " endpoints" );
		}

		Endpoint bound = driver.listen( endpoint );
		endpoints.add( bound );
		LOG.info( "Listening on {}", bound );
		return bound;
	}


	@Nonnull
	public List<Endpoint> getEndpoints() {
		return Collections.unmodifiableList( endpoints );
	}


	/**
	 * Set the number of threads servicing calls. Clients connected already are told of
	 * the change.
	 */
	public void setMaxThreads( int max_threads ) {
		if ( max_threads < 1 ) {
			throw new IllegalArgumentException( "Invalid thread count: " + max_threads );
		}

		int old_max;
		synchronized( max_threads_lock ) {
			old_max = this.max_threads;
			if ( old_max == max_threads ) return;

			// The pool requires core <= max at every step
			if ( max_threads > old_max ) {
				worker_pool.setMaximumPoolSize( max_threads );
				worker_pool.setCorePoolSize( max_threads );
			}
			else {
				worker_pool.setCorePoolSize( max_threads );
				worker_pool.setMaximumPoolSize( max_threads );
			}
			this.max_threads = max_threads;
		}

		LOG.debug( "Max threads changed from {} to {}", old_max, max_threads );

		if ( state.get() == State.STARTED ) {
			for( ConduitSession session : listSessions() ) {
				session.advertiseThreadCount( max_threads );
			}
		}
	}


	public int getMaxThreads() {
		return max_threads;
	}


	/**
	 * Set the object handed to clients asking for the root object.
	 *
	 * @param root		The object, or null for none.
	 * @param strong	If true the server holds a reference to the object. If false the
	 * 					object is served only while something else keeps it alive.
	 */
	public void setRootObject( @Nullable LocalObject root, boolean strong ) {
		if ( root != null && strong ) root.retain();

		LocalObject previous;
		boolean previous_strong;
		synchronized( root_lock ) {
			previous = root_object;
			previous_strong = root_strong;
			root_object = root;
			root_strong = strong;
		}

		if ( previous != null && previous_strong ) previous.release();
	}


	/**
	 * @return		The root object, retained for the caller, or null if there is none
	 * 				or it has been destroyed.
	 */
	@Nullable
	LocalObject acquireRootObject() {
		synchronized( root_lock ) {
			if ( root_object == null ) return null;
			if ( root_strong ) return root_object.retain();
			return Conduit.tryRetain( root_object ) ? root_object : null;
		}
	}


	/**
	 * Start accepting sessions.
	 *
	 * @throws IllegalStateException	If the server was started or shut down already.
	 */
	public void start() {
		if ( !state.compareAndSet( State.NEW, State.STARTED ) ) {
			throw new IllegalStateException( "Server cannot be started from state " +
				state.get() );
		}
		LOG.info( "Server started with {} threads", max_threads );
	}


	public boolean isRunning() {
		return state.get() == State.STARTED;
	}


	/**
	 * Stop the server: every session is shut down, listeners are closed and the worker
	 * pool stops accepting work.
	 *
	 * @return		True if this call shut the server down.
	 */
	public boolean shutdown() {
		State previous = state.getAndSet( State.SHUT_DOWN );
		if ( previous == State.SHUT_DOWN ) return false;

		LOG.info( "Server shutting down" );

		List<ConduitSession> to_close = listSessions();
		for( ConduitSession session : to_close ) {
			session.shutdownInternal( true, "server shutting down" );
		}

		worker_pool.shutdown();
		driver.shutdown();
		setRootObject( null, false );

		shutdown_latch.countDown();
		return true;
	}


	/**
	 * Wait for the server to shut down and its worker threads to finish. When called
	 * from a worker thread, only waits for the shutdown itself.
	 */
	public void join() throws InterruptedException {
		shutdown_latch.await();

		if ( Thread.currentThread().getThreadGroup() == WORKER_GROUP ) return;

		while( !worker_pool.awaitTermination( 1, TimeUnit.SECONDS ) ) {
			LOG.debug( "Waiting for worker threads to finish" );
		}

		// Waits for IO threads when the shutdown happened on one of them
		driver.shutdown();
	}


	/**
	 * Sessions currently connected.
	 */
	@Nonnull
	public List<ConduitSession> listSessions() {
		sessions_lock.lock();
		try {
			return new ArrayList<>( sessions.values() );
		}
		finally {
			sessions_lock.unlock();
		}
	}


	void sessionClosed( @Nonnull ConduitSession session ) {
		sessions_lock.lock();
		try {
			sessions.remove( session.getSessionID(), session );
		}
		finally {
			sessions_lock.unlock();
		}
		LOG.debug( "Session {} closed", Long.toHexString( session.getSessionID() ) );
	}


	private void handleSessionInit( @Nonnull DriverConnection connection,
		@Nonnull SessionInitIMessage message ) throws CloseConnectionIndicator {

		OptionalInt version = ProtocolVersions.negotiateProtocolVersion(
			message.getMinProtocolVersion(), message.getPrefProtocolVersion() );
		if ( !version.isPresent() ) {
			throw refuse( Status.BAD_VERSION, "No common protocol version with " +
				connection.getRemoteAddressDescription() );
		}
		if ( state.get() != State.STARTED ) {
			throw refuse( Status.INVALID_OPERATION, "Server is not running" );
		}

		ConduitSession session;
		boolean created = false;
		sessions_lock.lock();
		try {
			if ( message.getSessionID() == 0 ) {
				if ( message.isReverse() ) {
					throw refuse( Status.BAD_VALUE,
						"Reverse connection without a session" );
				}
				if ( message.getMaxReverseThreads() < 0 ) {
					throw refuse( Status.BAD_VALUE, "Invalid reverse thread count: " +
						message.getMaxReverseThreads() );
				}

				long session_id;
				do {
					session_id = ThreadLocalRandom.current().nextLong();
				}
				while( session_id == 0 || sessions.containsKey( session_id ) );

				session = new ConduitSession( this, session_id,
					( byte ) version.getAsInt(), message.getMaxReverseThreads(), driver,
					worker_pool, WORKER_GROUP, oneway_capacity );
				sessions.put( session_id, session );
				created = true;
			}
			else {
				session = sessions.get( message.getSessionID() );
				if ( session == null ) {
					throw refuse( Status.INVALID_OPERATION, "Unknown session: " +
						Long.toHexString( message.getSessionID() ) );
				}
			}
		}
		finally {
			sessions_lock.unlock();
		}

		try {
			session.acceptConnection( connection, message.isReverse(),
				new SessionInitResponseIMessage( Status.OK, ( byte ) version.getAsInt(),
				session.getSessionID(), max_threads ) );
		}
		catch( CloseConnectionIndicator ex ) {
			if ( created ) session.shutdownInternal( false, "handshake failed" );
			throw ex;
		}

		if ( created ) {
			LOG.debug( "New session {} from {}", Long.toHexString( session.getSessionID() ),
				connection.getRemoteAddressDescription() );
		}
	}


	private static CloseConnectionIndicator refuse( int status, String reason ) {
		LOG.debug( "Refusing connection: {}", reason );
		return new CloseConnectionIndicator( SessionInitResponseIMessage.refuse( status ),
			reason );
	}


	@Override
	public String toString() {
		return "ConduitServer{" +
			"endpoints=" + endpoints +
			", state=" + state.get() +
			", max_threads=" + max_threads +
			'}';
	}


	private class ServerMessageHandler implements InboundMessageHandler {
		@Override
		public void connectionOpened( @Nonnull DriverConnection connection,
			boolean opened_locally ) {

			LOG.trace( "Connection from {}", connection.getRemoteAddressDescription() );
		}

		@Override
		public IMessage receivedMessage( @Nonnull DriverConnection connection,
			@Nonnull IMessage message ) throws CloseConnectionIndicator {

			Object attachment = connection.getAttachment();
			if ( attachment instanceof Connection ) {
				Connection conn = ( Connection ) attachment;
				conn.getSession().messageReceived( conn, message );
				return null;
			}

			switch( message.getType() ) {
				case SESSION_INIT:
					handleSessionInit( connection, ( SessionInitIMessage ) message );
					return null;

				case TRANSACT:
					TransactIMessage transact = ( TransactIMessage ) message;
					throw new CloseConnectionIndicator( transact.isOneway() ? null :
						new ReplyIMessage( Status.BAD_TYPE ),
						"Transaction received before session was established" );

				default:
					throw new CloseConnectionIndicator( null, "Unexpected " +
						message.getType() + " before session was established" );
			}
		}

		@Override
		public void connectionClosed( @Nonnull DriverConnection connection,
			boolean closed_locally ) {

			Object attachment = connection.getAttachment();
			if ( attachment instanceof Connection ) {
				Connection conn = ( Connection ) attachment;
				conn.getSession().connectionClosed( conn );
			}
		}
	}


	public static class Builder {
		private ConduitDriver driver;
		private int max_threads = 1;
		private int oneway_capacity = ConduitSession.DEFAULT_ONEWAY_CAPACITY;


		/**
		 * Driver used to listen for connections. The server takes ownership of it. If
		 * not specified, the default driver is used.
		 */
		public Builder driver( @Nonnull ConduitDriver driver ) {
			this.driver = requireNonNull( driver );
			return this;
		}

		/**
		 * Number of threads servicing calls. Defaults to one.
		 */
		public Builder maxThreads( int max_threads ) {
			if ( max_threads < 1 ) {
				throw new IllegalArgumentException( "Invalid thread count: " + max_threads );
			}
			this.max_threads = max_threads;
			return this;
		}

		/**
		 * Maximum number of pending one-way calls per object before the session making
		 * them is considered broken.
		 */
		public Builder onewayQueueCapacity( int capacity ) {
			if ( capacity < 1 ) {
				throw new IllegalArgumentException( "Invalid capacity: " + capacity );
			}
			this.oneway_capacity = capacity;
			return this;
		}


		@Nonnull
		public ConduitServer build() {
			ConduitDriver driver = this.driver == null ? DefaultDriver.create() : this.driver;

			ConduitServer server = new ConduitServer( driver, max_threads, oneway_capacity );
			driver.init( server.new ServerMessageHandler() );
			return server;
		}
	}
}
