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
import com.starlight.conduit.exception.ConnectionFailureException;
import com.starlight.conduit.message.IMessage;
import com.starlight.conduit.message.ObjectRefIMessage;
import com.starlight.conduit.message.ReplyIMessage;
import com.starlight.conduit.message.SessionCloseIMessage;
import com.starlight.conduit.message.SessionInitIMessage;
import com.starlight.conduit.message.SessionInitResponseIMessage;
import com.starlight.conduit.message.ThreadCountIMessage;
import com.starlight.conduit.message.TransactIMessage;
import gnu.trove.map.TIntLongMap;
import gnu.trove.map.hash.TIntLongHashMap;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;


/**
 * A logical channel between a client and a server, made up of one or more driver
 * connections.
 * <p>
 * Connections are either {@link Connection.Direction#OUTGOING outgoing}, carrying calls
 * made by this side, or {@link Connection.Direction#INCOMING incoming}, carrying calls
 * made by the peer. A two-way call holds its connection until the reply arrives; calls
 * the peer makes back into this process while the reply is pending arrive on the same
 * connection and are handled by the waiting thread. The loss of any connection ends the
 * session.
 * <p>
 * Client sessions are created with {@link #newBuilder()}. Server sessions are created
 * by a {@link ConduitServer} as clients connect.
 */
public class ConduitSession {
	private static final Logger LOG = LoggerFactory.getLogger( ConduitSession.class );

	static final int DEFAULT_ONEWAY_CAPACITY =
		Integer.getInteger( "conduit.oneway.max_pending", 10000 );
	private static final int MAX_INBOUND =
		Integer.getInteger( "conduit.connection.max_inbound", 100000 );
	private static final long DEFAULT_CONNECT_TIMEOUT_MS =
		Long.getLong( "conduit.connect_timeout", 10000 );
	private static final int DETACHED_THREADS =
		Integer.getInteger( "conduit.detached.max_threads", 4 );

	// Transactions addressed to handle zero are commands for the session itself
	static final int SESSION_HANDLE = 0;
	static final int COMMAND_GET_ROOT = 0;
	static final int COMMAND_GET_MAX_THREADS = 1;

	// Threads belonging to session pools, which must not wait for a pool to terminate.
	// Shared by every session since thread groups are never reclaimed.
	private static final ThreadGroup CLIENT_WORKER_GROUP =
		new ThreadGroup( "conduit-client-worker" );
	private static final ThreadGroup DETACHED_GROUP = new ThreadGroup( "conduit-detached" );

	// Connections the current thread is servicing (most recent first)
	private static final ThreadLocal<Deque<Connection>> SERVICING =
		ThreadLocal.withInitial( ArrayDeque::new );


	private enum State {
		ALIVE,
		SHUTTING_DOWN,
		TERMINATED
	}


	private final ConduitServer server;
	private final ConduitDriver driver;
	private final Endpoint endpoint;
	private final long connect_timeout_ms;

	private final ThreadPoolExecutor worker_pool;
	private final ThreadGroup worker_group;
	private final boolean owns_resources;

	private final int max_reverse_threads;
	private final ObjectTable object_table;
	private final IncomingCallHandler incoming_calls;

	// Number of one-way calls sent, by target handle
	private final TIntLongMap oneway_sent = new TIntLongHashMap();

	private volatile long session_id;
	private volatile byte protocol_version;

	private final Lock connection_lock = new ReentrantLock();
	private final Condition connection_available = connection_lock.newCondition();
	private final List<Connection> outgoing = new ArrayList<>();
	private final List<Connection> incoming = new ArrayList<>();
	private int peer_max_threads;               // guarded by connection_lock
	private boolean growing = false;            // guarded by connection_lock

	private final AtomicReference<State> state = new AtomicReference<>( State.ALIVE );
	private final CountDownLatch terminated_latch = new CountDownLatch( 1 );

	private final Object detached_lock = new Object();
	private ScheduledThreadPoolExecutor detached_pool;    // guarded by detached_lock


	/**
	 * Client session.
	 */
	private ConduitSession( @Nonnull ConduitDriver driver, @Nonnull Endpoint endpoint,
		long connect_timeout_ms, int max_reverse_threads, int oneway_capacity ) {

		this.server = null;
		this.driver = driver;
		this.endpoint = endpoint;
		this.connect_timeout_ms = connect_timeout_ms;
		this.max_reverse_threads = max_reverse_threads;
		this.owns_resources = true;

		this.worker_group = CLIENT_WORKER_GROUP;
		if ( max_reverse_threads > 0 ) {
			worker_pool = new ThreadPoolExecutor( max_reverse_threads, max_reverse_threads,
				30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
				new DefaultThreadFactory( "conduit-client-worker", true,
					Thread.NORM_PRIORITY, worker_group ) );
			worker_pool.allowCoreThreadTimeOut( true );
		}
		else worker_pool = null;

		this.object_table =
			new ObjectTable( this, this::sendControl, worker_pool, oneway_capacity );
		this.incoming_calls =
			new IncomingCallHandler( this, object_table, oneway_capacity );
	}


	/**
	 * Server session.
	 */
	ConduitSession( @Nonnull ConduitServer server, long session_id, byte protocol_version,
		int peer_max_reverse_threads, @Nonnull ConduitDriver driver,
		@Nonnull ThreadPoolExecutor worker_pool, @Nonnull ThreadGroup worker_group,
		int oneway_capacity ) {

		this.server = server;
		this.driver = driver;
		this.endpoint = null;
		this.connect_timeout_ms = 0;
		this.session_id = session_id;
		this.protocol_version = protocol_version;
		this.peer_max_threads = peer_max_reverse_threads;
		this.max_reverse_threads = peer_max_reverse_threads;
		this.worker_pool = worker_pool;
		this.worker_group = worker_group;
		this.owns_resources = false;

		this.object_table =
			new ObjectTable( this, this::sendControl, worker_pool, oneway_capacity );
		this.incoming_calls =
			new IncomingCallHandler( this, object_table, oneway_capacity );
	}


	public static Builder newBuilder() {
		return new Builder();
	}


	/**
	 * Identifier assigned to the session by the server.
	 */
	public long getSessionID() {
		return session_id;
	}

	public byte getProtocolVersion() {
		return protocol_version;
	}

	/**
	 * The server which accepted the session, or null for a client session.
	 */
	@Nullable
	public ConduitServer getServer() {
		return server;
	}

	/**
	 * Number of threads the peer has for servicing calls from this side. For a client
	 * session this is the server's thread count; for a server session, the client's
	 * reverse thread count.
	 */
	public int getMaxThreads() {
		connection_lock.lock();
		try {
			return peer_max_threads;
		}
		finally {
			connection_lock.unlock();
		}
	}

	/**
	 * Number of threads servicing calls from the peer on a client session. Zero means
	 * the session does not accept calls from the server.
	 */
	public int getMaxReverseThreads() {
		return max_reverse_threads;
	}

	public boolean isAlive() {
		return state.get() == State.ALIVE;
	}

	/**
	 * Number of objects in which this side or the peer still has interest on this
	 * session.
	 */
	public int countLiveObjects() {
		return object_table.countLive();
	}

	@Nonnull
	ObjectTable getObjectTable() {
		return object_table;
	}


	/**
	 * Fetch the server's root object.
	 *
	 * @return		A proxy for the root object, which the caller must release, or null
	 * 				if the server has no root object or the request failed.
	 */
	@Nullable
	public RemoteObject getRootObject() {
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			int status = transact( SESSION_HANDLE, COMMAND_GET_ROOT, data, reply, 0 );
			if ( status != Status.OK ) {
				LOG.debug( "Unable to get root object on session {}: {}",
					Long.toHexString( session_id ), Status.toString( status ) );
				return null;
			}

			RemoteObject root = reply.readStrongBinder();
			return root == null ? null : root.retain();
		}
	}


	/**
	 * Shut the session down: the peer is notified, pending one-way and detached tasks
	 * are discarded and every connection is closed. Objects exported on the session
	 * are released.
	 *
	 * @param wait		If true, wait for threads owned by the session to finish. Ignored
	 * 					when called from one of those threads.
	 *
	 * @return			True if this call shut the session down, false if it was
	 * 					already shut down.
	 */
	public boolean shutdown( boolean wait ) {
		boolean performed = shutdownInternal( true, "shutdown requested" );
		if ( wait ) awaitTermination();
		return performed;
	}


	/**
	 * Drop every connection without notifying the peer, as if this process had died.
	 * Requires {@link ConduitExperimental#acknowledge()}.
	 */
	public void abort() {
		ConduitExperimental.check( "ConduitSession.abort()" );
		shutdownInternal( false, "aborted" );
	}


	/**
	 * Schedule a task which runs outside any call, on a bounded pool belonging to the
	 * session. Tasks which have not started are cancelled when the session shuts down.
	 *
	 * @throws RejectedExecutionException	If the session is shut down.
	 */
	ScheduledFuture<?> scheduleDetached( @Nonnull Runnable task, long delay,
		@Nonnull TimeUnit unit ) {

		requireNonNull( task );
		synchronized( detached_lock ) {
			if ( state.get() != State.ALIVE ) {
				throw new RejectedExecutionException( "Session is shut down" );
			}

			if ( detached_pool == null ) {
				detached_pool = new ScheduledThreadPoolExecutor( DETACHED_THREADS,
					new DefaultThreadFactory( "conduit-detached", true,
						Thread.NORM_PRIORITY, DETACHED_GROUP ) );
				detached_pool.setExecuteExistingDelayedTasksAfterShutdownPolicy( false );
				detached_pool.setRemoveOnCancelPolicy( true );
			}

			return detached_pool.schedule( () -> {
				try {
					task.run();
				}
				catch( RuntimeException ex ) {
					LOG.warn( "Detached task {} threw an exception", task, ex );
				}
			}, delay, unit );
		}
	}


	////////////////////////////////////////////////////////////////////////////////
	// Outbound calls

	/**
	 * Send a transaction to an object owned by the peer.
	 *
	 * @return		The status returned by the target, or a local failure status.
	 */
	int transact( int handle, int code, @Nonnull Parcel data, @Nullable Parcel reply,
		int flags ) {

		if ( state.get() != State.ALIVE ) return Status.DEAD_OBJECT;

		boolean oneway = ( flags & RemoteObject.FLAG_ONEWAY ) != 0;

		// A two-way call made while servicing a call from the peer goes back over the
		// same connection so the peer's waiting thread handles it.
		Connection conn = oneway ? null : currentConnection();
		boolean nested = conn != null;
		if ( !nested ) {
			try {
				conn = acquireOutgoing();
			}
			catch( StatusException ex ) {
				LOG.debug( "No connection for call to {} on session {}: {}", handle,
					Long.toHexString( session_id ), ex.toString() );
				return ex.getStatus();
			}
		}

		try {
			byte[] payload;
			try {
				payload = data.flatten( object_table );
			}
			catch( StatusException ex ) {
				LOG.debug( "Unable to send arguments for call to {}: {}", handle,
					ex.toString() );
				return ex.getStatus();
			}

			// One-way calls are numbered per target so the peer can run them in the
			// order they were sent whichever connection they travel on. A two-way call
			// carries the count sent so far, which the peer runs first.
			long sequence = 0;
			if ( handle != SESSION_HANDLE ) {
				synchronized( oneway_sent ) {
					sequence = oneway_sent.get( handle );
					if ( oneway ) oneway_sent.put( handle, sequence + 1 );
				}
			}

			try {
				conn.send( new TransactIMessage( handle, code,
					oneway ? TransactIMessage.FLAG_ONEWAY : 0, sequence, payload ) );
			}
			catch( IOException ex ) {
				LOG.debug( "Send failed on {}", conn, ex );
				// Later calls to the target would wait for the lost one-way call
				if ( oneway ) shutdownInternal( false, "send failed" );
				return Status.DEAD_OBJECT;
			}

			if ( oneway ) return Status.OK;

			Deque<Connection> servicing = SERVICING.get();
			servicing.push( conn );
			try {
				return awaitReply( conn, reply );
			}
			finally {
				servicing.pop();
			}
		}
		finally {
			if ( !nested ) finishCall( conn );
		}
	}


	private int awaitReply( @Nonnull Connection conn, @Nullable Parcel reply ) {
		while( true ) {
			IMessage message = conn.take();
			if ( message == Connection.CLOSED ) return Status.DEAD_OBJECT;

			switch( message.getType() ) {
				case REPLY:
					ReplyIMessage reply_message = ( ReplyIMessage ) message;
					Parcel destination = reply == null ? new Parcel() : reply;
					try {
						destination.unflatten( reply_message.getPayload(), object_table );
					}
					catch( StatusException ex ) {
						LOG.debug( "Invalid reply on {}: {}", conn, ex.toString() );
						return ex.getStatus();
					}
					finally {
						if ( reply == null ) destination.recycle();
					}
					return reply_message.getStatus();

				case TRANSACT:
					incoming_calls.processTransaction( conn, ( TransactIMessage ) message );
					break;

				default:
					LOG.warn( "Unexpected {} message on {} while waiting for a reply",
						message.getType(), conn );
					conn.close();
					return Status.DEAD_OBJECT;
			}
		}
	}


	/**
	 * Claim a free outgoing connection, opening another if the peer has threads to
	 * spare, or waiting for one to be released.
	 */
	private Connection acquireOutgoing() throws StatusException {
		connection_lock.lock();
		try {
			while( true ) {
				if ( state.get() != State.ALIVE ) {
					throw new StatusException( Status.DEAD_OBJECT, "Session is shut down" );
				}

				for( Connection conn : outgoing ) {
					if ( !conn.busy && conn.isOpen() ) {
						conn.busy = true;
						return conn;
					}
				}

				boolean can_grow = endpoint != null && outgoing.size() < peer_max_threads;
				if ( outgoing.isEmpty() && !can_grow && !growing ) {
					throw new StatusException( Status.WOULD_BLOCK,
						"Peer is not accepting calls on this session" );
				}

				if ( can_grow && !growing ) {
					growing = true;
					break;
				}

				connection_available.awaitUninterruptibly();
			}
		}
		finally {
			connection_lock.unlock();
		}

		// Opening a connection blocks, so it is done outside the lock
		Connection conn = null;
		try {
			conn = openConnection( false, true );
		}
		catch( IOException ex ) {
			LOG.warn( "Unable to open additional connection for session {}",
				Long.toHexString( session_id ), ex );
		}
		finally {
			connection_lock.lock();
			try {
				growing = false;
				// Stop trying to grow past what has worked
				if ( conn == null ) peer_max_threads = Math.max( 1, outgoing.size() );
				connection_available.signalAll();
			}
			finally {
				connection_lock.unlock();
			}
		}

		return conn == null ? acquireOutgoing() : conn;
	}


	/**
	 * Give back a connection after a call made by this side. Anything the peer sent
	 * after the reply is handed to the worker pool.
	 */
	private void finishCall( @Nonnull Connection conn ) {
		boolean service;
		connection_lock.lock();
		try {
			service = conn.hasQueued() && conn.isOpen();
			if ( !service ) {
				conn.busy = false;
				connection_available.signalAll();
			}
		}
		finally {
			connection_lock.unlock();
		}

		if ( service ) scheduleService( conn );
	}


	////////////////////////////////////////////////////////////////////////////////
	// Inbound calls

	/**
	 * Handle a message received on one of the session's connections. Called on a
	 * driver IO thread.
	 */
	void messageReceived( @Nonnull Connection conn, @Nonnull IMessage message )
		throws CloseConnectionIndicator {

		switch( message.getType() ) {
			case TRANSACT:
				if ( ( ( TransactIMessage ) message ).isOneway() ) {
					if ( worker_pool == null ) {
						LOG.warn( "Received a one-way call on {} but no threads are " +
							"available to service calls from the peer", conn );
						conn.close();
						return;
					}
					incoming_calls.onewayReceived( conn, ( TransactIMessage ) message );
					break;
				}
				// fall through

			case REPLY:
				if ( !conn.enqueue( message ) ) {
					LOG.warn( "Too many messages queued on {}, shutting down session {}",
						conn, Long.toHexString( session_id ) );
					shutdownInternal( true, "inbound queue overflow" );
					return;
				}
				serviceIfIdle( conn );
				break;

			case ACQUIRE:
				ObjectRefIMessage acquire = ( ObjectRefIMessage ) message;
				object_table.acquired( acquire.getHandle(), acquire.isWeak(),
					acquire.getCount() );
				break;

			case RELEASE:
				ObjectRefIMessage release = ( ObjectRefIMessage ) message;
				object_table.released( release.getHandle(), release.isWeak(),
					release.getCount() );
				break;

			case THREAD_COUNT:
				if ( server != null ) {
					LOG.debug( "Ignoring thread count from client on {}", conn );
					break;
				}
				int max_threads = ( ( ThreadCountIMessage ) message ).getMaxThreads();
				LOG.debug( "Server thread count for session {} is now {}",
					Long.toHexString( session_id ), max_threads );
				connection_lock.lock();
				try {
					peer_max_threads = max_threads;
					connection_available.signalAll();
				}
				finally {
					connection_lock.unlock();
				}
				break;

			case SESSION_CLOSE:
				LOG.debug( "Peer closed session {}: {}", Long.toHexString( session_id ),
					( ( SessionCloseIMessage ) message ).getReason() );
				shutdownInternal( false, "closed by peer" );
				break;

			default:
				throw new CloseConnectionIndicator( null,
					"Unexpected message: " + message.getType() );
		}
	}


	/**
	 * Called when a connection belonging to the session has closed.
	 */
	void connectionClosed( @Nonnull Connection conn ) {
		conn.markClosed();

		connection_lock.lock();
		try {
			connection_available.signalAll();
		}
		finally {
			connection_lock.unlock();
		}

		if ( state.get() == State.ALIVE ) {
			LOG.debug( "Lost {}, shutting down session {}", conn,
				Long.toHexString( session_id ) );
			shutdownInternal( false, "connection lost" );
		}
	}


	private void serviceIfIdle( @Nonnull Connection conn ) {
		connection_lock.lock();
		try {
			// A busy connection is being serviced already, possibly by a thread waiting
			// for a reply.
			if ( conn.busy ) return;

			// The message may already have been consumed: a reply is taken by the caller
			// waiting for it, who can give the connection back before this runs.
			if ( !conn.hasQueued() ) return;
			conn.busy = true;
		}
		finally {
			connection_lock.unlock();
		}

		scheduleService( conn );
	}


	private void scheduleService( @Nonnull Connection conn ) {
		if ( worker_pool == null ) {
			LOG.warn( "Received a call on {} but no threads are available to service " +
				"calls from the peer", conn );
			conn.close();
			return;
		}

		try {
			worker_pool.execute( () -> serviceConnection( conn ) );
		}
		catch( RejectedExecutionException ex ) {
			LOG.debug( "Unable to service {}: pool is shut down", conn );
			conn.close();
		}
	}


	/**
	 * Handle queued messages on a connection until the queue is empty.
	 */
	private void serviceConnection( @Nonnull Connection conn ) {
		Deque<Connection> servicing = SERVICING.get();
		servicing.push( conn );
		try {
			while( true ) {
				IMessage message = conn.poll();

				if ( message == null ) {
					if ( releaseIfDrained( conn ) ) return;
					continue;
				}

				if ( message == Connection.CLOSED ) {
					releaseIfDrained( conn );
					return;
				}

				if ( message instanceof TransactIMessage ) {
					incoming_calls.processTransaction( conn, ( TransactIMessage ) message );
				}
				else {
					LOG.warn( "Unexpected {} message on {} with no call waiting",
						message.getType(), conn );
					conn.close();
				}
			}
		}
		catch( RuntimeException ex ) {
			LOG.error( "Error servicing {}", conn, ex );
			conn.close();
			releaseIfDrained( conn );
		}
		finally {
			servicing.pop();
		}
	}


	private boolean releaseIfDrained( @Nonnull Connection conn ) {
		connection_lock.lock();
		try {
			if ( conn.hasQueued() && conn.isOpen() ) return false;

			conn.busy = false;
			connection_available.signalAll();
			return true;
		}
		finally {
			connection_lock.unlock();
		}
	}


	////////////////////////////////////////////////////////////////////////////////
	// Control messages

	/**
	 * Send a control message. The connection the current thread is servicing is used
	 * when there is one so the message is ordered with the call being handled. Failures
	 * are dropped: the peer forgets its state when the session goes away.
	 */
	void sendControl( @Nonnull IMessage message ) {
		Connection conn = currentConnection();
		if ( conn == null ) conn = anyOpenConnection();
		if ( conn == null ) {
			LOG.debug( "No connection available to send {} on session {}", message,
				Long.toHexString( session_id ) );
			return;
		}

		try {
			conn.send( message );
		}
		catch( IOException ex ) {
			LOG.debug( "Unable to send {} on {}", message, conn, ex );
		}
	}


	@Nullable
	private Connection currentConnection() {
		for( Connection conn : SERVICING.get() ) {
			if ( conn.getSession() == this && conn.isOpen() ) return conn;
		}
		return null;
	}


	@Nullable
	private Connection anyOpenConnection() {
		connection_lock.lock();
		try {
			for( Connection conn : outgoing ) {
				if ( conn.isOpen() ) return conn;
			}
			for( Connection conn : incoming ) {
				if ( conn.isOpen() ) return conn;
			}
			return null;
		}
		finally {
			connection_lock.unlock();
		}
	}


	////////////////////////////////////////////////////////////////////////////////
	// Connection setup

	/**
	 * Open the initial connections of a client session.
	 */
	private void establish() throws IOException {
		openConnection( false, false );

		int connections;
		connection_lock.lock();
		try {
			connections = peer_max_threads;
		}
		finally {
			connection_lock.unlock();
		}

		for( int i = 1; i < connections; i++ ) {
			openConnection( false, false );
		}
		for( int i = 0; i < max_reverse_threads; i++ ) {
			openConnection( true, false );
		}

		LOG.debug( "Session {} established with {} ({} outgoing, {} reverse connections)",
			Long.toHexString( session_id ), endpoint, connections, max_reverse_threads );
	}


	/**
	 * Open a connection from a client session and perform the handshake.
	 *
	 * @param reverse		True for a connection which carries calls from the server.
	 * @param keep_busy		True to return the connection claimed by the calling
	 * 						thread.
	 */
	private Connection openConnection( boolean reverse, boolean keep_busy )
		throws IOException {

		DriverConnection driver_connection =
			driver.connect( endpoint, connect_timeout_ms, TimeUnit.MILLISECONDS );

		Connection conn = new Connection( this, driver_connection,
			reverse ? Connection.Direction.INCOMING : Connection.Direction.OUTGOING,
			MAX_INBOUND );
		conn.busy = true;
		driver_connection.setAttachment( conn );

		try {
			if ( !driver_connection.isOpen() ) {
				throw new ConnectionFailureException( "Connection closed by server" );
			}

			driver_connection.send( new SessionInitIMessage(
				ProtocolVersions.MIN_PROTOCOL_VERSION, ProtocolVersions.PROTOCOL_VERSION,
				session_id, reverse, max_reverse_threads ) );

			IMessage message;
			try {
				message = conn.poll( connect_timeout_ms, TimeUnit.MILLISECONDS );
			}
			catch( InterruptedException ex ) {
				throw new InterruptedIOException( "Interrupted during handshake" );
			}

			if ( message == null ) {
				throw new ConnectionFailureException( "Timed out waiting for handshake " +
					"response from " + endpoint );
			}
			if ( message == Connection.CLOSED ) {
				throw new ConnectionFailureException( "Connection closed during handshake" );
			}
			if ( !( message instanceof SessionInitResponseIMessage ) ) {
				throw new ConnectionFailureException( "Unexpected message during " +
					"handshake: " + message.getType() );
			}

			SessionInitResponseIMessage response = ( SessionInitResponseIMessage ) message;
			if ( response.getStatus() != Status.OK ) {
				throw new ConnectionFailureException( "Connection refused by server: " +
					Status.toString( response.getStatus() ) );
			}
			if ( response.getProtocolVersion() < ProtocolVersions.MIN_PROTOCOL_VERSION ||
				response.getProtocolVersion() > ProtocolVersions.PROTOCOL_VERSION ) {

				throw new ConnectionFailureException( "Server chose unsupported protocol " +
					"version " + response.getProtocolVersion() );
			}

			if ( session_id == 0 ) {
				session_id = response.getSessionID();
				protocol_version = response.getProtocolVersion();
				connection_lock.lock();
				try {
					peer_max_threads = response.getMaxThreads();
				}
				finally {
					connection_lock.unlock();
				}
			}
			else if ( response.getSessionID() != session_id ) {
				throw new ConnectionFailureException( "Server joined connection to " +
					"session " + Long.toHexString( response.getSessionID() ) +
					" instead of " + Long.toHexString( session_id ) );
			}
		}
		catch( IOException ex ) {
			driver_connection.close();
			throw ex;
		}

		boolean service;
		connection_lock.lock();
		try {
			if ( reverse ) incoming.add( conn );
			else outgoing.add( conn );

			service = !keep_busy && conn.hasQueued();
			if ( !keep_busy && !service ) {
				conn.busy = false;
				connection_available.signalAll();
			}
		}
		finally {
			connection_lock.unlock();
		}

		if ( service ) scheduleService( conn );

		// Lost while being added
		if ( !conn.isOpen() && state.get() == State.ALIVE ) connectionClosed( conn );

		return conn;
	}


	/**
	 * Join a connection to a server session after a successful handshake. Called on
	 * the driver IO thread of the connection.
	 *
	 * @param reverse		True if the client will service calls made over the
	 * 						connection.
	 */
	void acceptConnection( @Nonnull DriverConnection driver_connection, boolean reverse,
		@Nonnull SessionInitResponseIMessage response ) throws CloseConnectionIndicator {

		Connection conn = new Connection( this, driver_connection,
			reverse ? Connection.Direction.OUTGOING : Connection.Direction.INCOMING,
			MAX_INBOUND );

		connection_lock.lock();
		try {
			if ( state.get() != State.ALIVE ) {
				throw new CloseConnectionIndicator(
					SessionInitResponseIMessage.refuse( Status.DEAD_OBJECT ),
					"Session is shut down" );
			}
			if ( reverse && outgoing.size() >= max_reverse_threads ) {
				throw new CloseConnectionIndicator(
					SessionInitResponseIMessage.refuse( Status.BAD_VALUE ),
					"Too many reverse connections" );
			}

			// The peer sends nothing on the connection until it has the response, and
			// nothing else is received on this thread meanwhile.
			driver_connection.setAttachment( conn );
			try {
				driver_connection.send( response );
			}
			catch( IOException ex ) {
				driver_connection.setAttachment( null );
				throw new CloseConnectionIndicator( null,
					"Unable to send handshake response: " + ex );
			}

			if ( reverse ) outgoing.add( conn );
			else incoming.add( conn );
			connection_available.signalAll();
		}
		finally {
			connection_lock.unlock();
		}

		LOG.debug( "Accepted {} for session {}", conn, Long.toHexString( session_id ) );
	}


	/**
	 * Tell the client the server's thread count has changed.
	 */
	void advertiseThreadCount( int max_threads ) {
		if ( !ProtocolVersions.supportsThreadCountUpdates( protocol_version ) ) return;

		Connection conn = anyOpenConnection();
		if ( conn == null ) return;

		try {
			conn.send( new ThreadCountIMessage( max_threads ) );
		}
		catch( IOException ex ) {
			LOG.debug( "Unable to send thread count on {}", conn, ex );
		}
	}


	////////////////////////////////////////////////////////////////////////////////
	// Shutdown

	/**
	 * @param notify_peer		True to send a close message to the peer first.
	 *
	 * @return					True if this call shut the session down.
	 */
	boolean shutdownInternal( boolean notify_peer, @Nonnull String reason ) {
		if ( !state.compareAndSet( State.ALIVE, State.SHUTTING_DOWN ) ) return false;

		LOG.debug( "Shutting down session {}: {}", Long.toHexString( session_id ), reason );

		List<Connection> connections = new ArrayList<>();
		connection_lock.lock();
		try {
			connections.addAll( outgoing );
			connections.addAll( incoming );
			connection_available.signalAll();
		}
		finally {
			connection_lock.unlock();
		}

		if ( notify_peer ) {
			for( Connection conn : connections ) {
				if ( !conn.isOpen() ) continue;
				try {
					conn.send( new SessionCloseIMessage( reason ) );
					break;
				}
				catch( IOException ex ) {
					LOG.debug( "Unable to send session close on {}", conn, ex );
				}
			}
		}

		incoming_calls.close();
		object_table.close();

		synchronized( detached_lock ) {
			if ( detached_pool != null ) detached_pool.shutdown();
		}

		connections.forEach( Connection::close );
		connection_lock.lock();
		try {
			connection_available.signalAll();
		}
		finally {
			connection_lock.unlock();
		}

		if ( server != null ) server.sessionClosed( this );

		if ( owns_resources ) {
			if ( worker_pool != null ) worker_pool.shutdown();
			driver.shutdown();
		}

		state.set( State.TERMINATED );
		terminated_latch.countDown();
		return true;
	}


	private void awaitTermination() {
		boolean interrupted = false;
		try {
			while( true ) {
				try {
					terminated_latch.await();
					break;
				}
				catch( InterruptedException ex ) {
					interrupted = true;
				}
			}

			ThreadGroup group = Thread.currentThread().getThreadGroup();
			if ( group == DETACHED_GROUP || group == worker_group ) return;

			ScheduledThreadPoolExecutor detached;
			synchronized( detached_lock ) {
				detached = detached_pool;
			}
			try {
				if ( detached != null ) {
					while( !detached.awaitTermination( 1, TimeUnit.SECONDS ) ) {
						LOG.debug( "Waiting for detached tasks of session {}",
							Long.toHexString( session_id ) );
					}
				}
				if ( owns_resources ) {
					// Waits for IO threads if the first shutdown happened on one of them
					driver.shutdown();
					if ( worker_pool != null ) {
						while( !worker_pool.awaitTermination( 1, TimeUnit.SECONDS ) ) {
							LOG.debug( "Waiting for workers of session {}",
								Long.toHexString( session_id ) );
						}
					}
				}
			}
			catch( InterruptedException ex ) {
				interrupted = true;
			}
		}
		finally {
			if ( interrupted ) Thread.currentThread().interrupt();
		}
	}


	@Override
	public String toString() {
		return "ConduitSession{" +
			"id=" + Long.toHexString( session_id ) +
			", " + ( server == null ? "client of " + endpoint : "server" ) +
			", state=" + state.get() +
			'}';
	}


	/**
	 * Handles messages for the connections of a client session.
	 */
	private class ClientMessageHandler implements InboundMessageHandler {
		@Override
		public void connectionOpened( @Nonnull DriverConnection connection,
			boolean opened_locally ) {

			LOG.trace( "Connection opened: {}", connection.getRemoteAddressDescription() );
		}

		@Override
		public IMessage receivedMessage( @Nonnull DriverConnection connection,
			@Nonnull IMessage message ) throws CloseConnectionIndicator {

			Connection conn = ( Connection ) connection.getAttachment();
			if ( conn == null ) {
				throw new CloseConnectionIndicator( null,
					"Message received on unknown connection" );
			}

			// Handshake responses go to the thread opening the connection
			if ( message instanceof SessionInitResponseIMessage ) {
				conn.enqueue( message );
			}
			else messageReceived( conn, message );
			return null;
		}

		@Override
		public void connectionClosed( @Nonnull DriverConnection connection,
			boolean closed_locally ) {

			Connection conn = ( Connection ) connection.getAttachment();
			if ( conn != null ) ConduitSession.this.connectionClosed( conn );
		}
	}


	public static class Builder {
		private ConduitDriver driver;
		private int max_reverse_threads = 0;
		private int oneway_capacity = DEFAULT_ONEWAY_CAPACITY;
		private long connect_timeout_ms = DEFAULT_CONNECT_TIMEOUT_MS;


		/**
		 * Driver used for the session's connections. The session takes ownership of
		 * it. If not specified, the default driver is used.
		 */
		public Builder driver( @Nonnull ConduitDriver driver ) {
			this.driver = requireNonNull( driver );
			return this;
		}

		/**
		 * Number of threads servicing calls made by the server on this session. The
		 * default of zero means the server cannot make calls back, including to
		 * objects this side passes to it.
		 */
		public Builder maxReverseThreads( int max_reverse_threads ) {
			if ( max_reverse_threads < 0 ) {
				throw new IllegalArgumentException( "Invalid thread count: " +
					max_reverse_threads );
			}
			this.max_reverse_threads = max_reverse_threads;
			return this;
		}

		/**
		 * Maximum number of pending one-way calls per object before the session is
		 * considered broken.
		 */
		public Builder onewayQueueCapacity( int capacity ) {
			if ( capacity < 1 ) {
				throw new IllegalArgumentException( "Invalid capacity: " + capacity );
			}
			this.oneway_capacity = capacity;
			return this;
		}

		public Builder connectTimeout( long timeout, @Nonnull TimeUnit unit ) {
			this.connect_timeout_ms = unit.toMillis( timeout );
			return this;
		}


		/**
		 * Connect to a server.
		 *
		 * @throws ConnectionFailureException	If the server refused the session.
		 * @throws UnsupportedOperationException	If the driver does not support the
		 * 										endpoint type.
		 */
		@Nonnull
		public ConduitSession connect( @Nonnull Endpoint endpoint ) throws IOException {
			requireNonNull( endpoint );

			ConduitDriver driver = this.driver == null ? DefaultDriver.create() : this.driver;
			if ( !driver.supports( endpoint.getType() ) ) {
				driver.shutdown();
				throw new UnsupportedOperationException( "Driver does not support " +
					endpoint.getType() + " endpoints" );
			}

			ConduitSession session = new ConduitSession( driver, endpoint,
				connect_timeout_ms, max_reverse_threads, oneway_capacity );
			driver.init( session.new ClientMessageHandler() );

			try {
				session.establish();
			}
			catch( IOException | RuntimeException ex ) {
				session.shutdownInternal( false, "connection failed" );
				throw ex;
			}
			return session;
		}
	}
}
