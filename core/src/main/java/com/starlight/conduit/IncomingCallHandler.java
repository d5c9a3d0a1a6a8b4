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

import com.starlight.conduit.message.ReplyIMessage;
import com.starlight.conduit.message.TransactIMessage;
import gnu.trove.map.TIntLongMap;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TLongObjectMap;
import gnu.trove.map.hash.TIntLongHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TLongObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Runs the transactions a session receives from its peer.
 * <p>
 * Two-way calls run on the thread servicing the connection they arrived on. One-way
 * calls are put in order on the driver IO thread, using the sequence number the sender
 * gave them, and then handed to the target's serial queue. A two-way call waits until
 * every one-way call to its target sent before it has been queued, and then until those
 * have run.
 */
final class IncomingCallHandler {
	private static final Logger LOG = LoggerFactory.getLogger( IncomingCallHandler.class );

	private static final long ONEWAY_ORDER_TIMEOUT_MS =
		Long.getLong( "conduit.oneway.order_timeout", 30000 );

	private static final byte[] EMPTY_PAYLOAD = new byte[ 0 ];


	private final ConduitSession session;
	private final ObjectTable object_table;
	private final int oneway_capacity;

	private final Lock oneway_lock = new ReentrantLock();
	private final Condition oneway_queued = oneway_lock.newCondition();
	// Sequence number of the next one-way call to queue, by handle
	private final TIntLongMap next_sequence = new TIntLongHashMap();
	// One-way calls received ahead of their turn, by handle and sequence number
	private final TIntObjectMap<TLongObjectMap<TransactIMessage>> early_calls =
		new TIntObjectHashMap<>();
	private boolean closed = false;             // guarded by oneway_lock


	IncomingCallHandler( @Nonnull ConduitSession session,
		@Nonnull ObjectTable object_table, int oneway_capacity ) {

		this.session = session;
		this.object_table = object_table;
		this.oneway_capacity = oneway_capacity;
	}


	/**
	 * Accept a one-way call. Called on the driver IO thread in the order calls arrive
	 * on the connection.
	 */
	void onewayReceived( @Nonnull Connection conn, @Nonnull TransactIMessage message ) {
		int handle = message.getTargetHandle();
		if ( handle == ConduitSession.SESSION_HANDLE ) {
			LOG.debug( "Ignoring one-way session command {} on {}", message.getCode(),
				conn );
			return;
		}

		String protocol_error = null;
		boolean overflow = false;

		oneway_lock.lock();
		try {
			if ( closed ) return;

			long expected = next_sequence.get( handle );
			long sequence = message.getOnewaySequence();
			TLongObjectMap<TransactIMessage> early = early_calls.get( handle );

			if ( sequence < expected ) {
				protocol_error = "Repeated one-way call " + sequence + " to " + handle;
			}
			else if ( sequence > expected ) {
				if ( early == null ) {
					early = new TLongObjectHashMap<>();
					early_calls.put( handle, early );
				}

				if ( early.containsKey( sequence ) ) {
					protocol_error = "Repeated one-way call " + sequence + " to " + handle;
				}
				else if ( early.size() >= oneway_capacity ) overflow = true;
				else early.put( sequence, message );
			}
			else {
				TransactIMessage next = message;
				while( next != null ) {
					if ( !queueOneway( next ) ) {
						overflow = true;
						break;
					}
					expected++;
					next = early == null ? null : early.remove( expected );
				}

				if ( early != null && early.isEmpty() ) early_calls.remove( handle );
				next_sequence.put( handle, expected );
				oneway_queued.signalAll();
			}
		}
		finally {
			oneway_lock.unlock();
		}

		if ( protocol_error != null ) {
			LOG.warn( "{} on {}, closing connection", protocol_error, conn );
			conn.close();
		}
		else if ( overflow && session.isAlive() ) {
			LOG.warn( "Too many one-way calls pending for handle {}, shutting down " +
				"session {}", handle, Long.toHexString( session.getSessionID() ) );
			session.shutdownInternal( true, "one-way queue overflow" );
		}
	}


	/**
	 * @return		False if the target's queue is full.
	 */
	private boolean queueOneway( @Nonnull TransactIMessage message ) {
		ObjectTable.Target target;
		try {
			target = object_table.lookupTarget( message.getTargetHandle() );
		}
		catch( StatusException ex ) {
			LOG.debug( "One-way call to unknown handle {}: {}", message.getTargetHandle(),
				ex.toString() );
			return true;
		}

		Parcel data = new Parcel();
		try {
			data.unflatten( message.getPayload(), object_table );
		}
		catch( StatusException ex ) {
			target.object.release();
			LOG.debug( "Invalid arguments for one-way call to {}: {}", target.object,
				ex.toString() );
			return true;
		}

		OnewayCall call = new OnewayCall( target.object, message.getCode(), data );
		if ( target.oneway_queue.submit( call ) ) return true;

		call.discard();
		return false;
	}


	/**
	 * Run a two-way call and send the reply on the connection it arrived on.
	 */
	void processTransaction( @Nonnull Connection conn,
		@Nonnull TransactIMessage message ) {

		if ( message.getTargetHandle() == ConduitSession.SESSION_HANDLE ) {
			processSessionCommand( conn, message );
			return;
		}

		ObjectTable.Target target;
		try {
			target = object_table.lookupTarget( message.getTargetHandle() );
		}
		catch( StatusException ex ) {
			LOG.debug( "Call to unknown handle {} on {}: {}", message.getTargetHandle(),
				conn, ex.toString() );
			sendReply( conn, ex.getStatus(), EMPTY_PAYLOAD );
			return;
		}

		if ( !awaitOneways( message.getTargetHandle(), message.getOnewaySequence() ) ) {
			target.object.release();
			sendReply( conn, Status.DEAD_OBJECT, EMPTY_PAYLOAD );
			return;
		}

		Parcel data = new Parcel();
		try {
			data.unflatten( message.getPayload(), object_table );
		}
		catch( StatusException ex ) {
			target.object.release();
			LOG.debug( "Invalid arguments for call to {}: {}", target.object,
				ex.toString() );
			sendReply( conn, ex.getStatus(), EMPTY_PAYLOAD );
			return;
		}

		// Calls to an object run after the one-way calls sent before them
		target.oneway_queue.awaitSubmitted();

		Parcel reply = new Parcel();
		try {
			int status;
			try {
				status = invoke( target.object, message.getCode(), data, reply, 0 );
			}
			finally {
				// Release messages for the arguments go out ahead of the reply
				data.recycle();
				target.object.release();
			}

			byte[] payload;
			try {
				payload = reply.flatten( object_table );
			}
			catch( StatusException ex ) {
				LOG.debug( "Unable to send reply from {}: {}", target.object,
					ex.toString() );
				status = ex.getStatus();
				payload = EMPTY_PAYLOAD;
			}
			sendReply( conn, status, payload );
		}
		finally {
			reply.recycle();
		}
	}


	/**
	 * Wait until the first {@code count} one-way calls to the handle have been queued.
	 *
	 * @return		False if the session closed or the calls never arrived, in which
	 * 				case the session is shut down.
	 */
	private boolean awaitOneways( int handle, long count ) {
		boolean interrupted = false;
		boolean timed_out = false;
		oneway_lock.lock();
		try {
			long remaining = TimeUnit.MILLISECONDS.toNanos( ONEWAY_ORDER_TIMEOUT_MS );
			while( !closed && next_sequence.get( handle ) < count ) {
				if ( remaining <= 0 ) {
					timed_out = true;
					break;
				}
				try {
					remaining = oneway_queued.awaitNanos( remaining );
				}
				catch( InterruptedException ex ) {
					interrupted = true;
				}
			}
			if ( closed ) return false;
		}
		finally {
			oneway_lock.unlock();
			if ( interrupted ) Thread.currentThread().interrupt();
		}

		if ( timed_out ) {
			LOG.warn( "One-way calls to handle {} before call {} never arrived, shutting " +
				"down session {}", handle, count, Long.toHexString( session.getSessionID() ) );
			session.shutdownInternal( true, "one-way calls missing" );
			return false;
		}
		return true;
	}


	private void processSessionCommand( @Nonnull Connection conn,
		@Nonnull TransactIMessage message ) {

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			try {
				data.unflatten( message.getPayload(), object_table );
			}
			catch( StatusException ex ) {
				sendReply( conn, ex.getStatus(), EMPTY_PAYLOAD );
				return;
			}

			ConduitServer server = session.getServer();
			int status = Status.OK;
			switch( message.getCode() ) {
				case ConduitSession.COMMAND_GET_ROOT:
					LocalObject root = server == null ? null : server.acquireRootObject();
					try {
						reply.writeStrongBinder( root );
					}
					finally {
						if ( root != null ) root.release();
					}
					break;

				case ConduitSession.COMMAND_GET_MAX_THREADS:
					reply.writeInt( server == null ? session.getMaxReverseThreads() :
						server.getMaxThreads() );
					break;

				default:
					status = Status.UNKNOWN_TRANSACTION;
			}

			byte[] payload;
			try {
				payload = reply.flatten( object_table );
			}
			catch( StatusException ex ) {
				status = ex.getStatus();
				payload = EMPTY_PAYLOAD;
			}
			sendReply( conn, status, payload );
		}
	}


	private int invoke( @Nonnull LocalObject target, int code, @Nonnull Parcel data,
		@Nonnull Parcel reply, int flags ) {

		boolean oneway = ( flags & RemoteObject.FLAG_ONEWAY ) != 0;
		Object previous = ConduitContext.setCallInfo( session, oneway );
		try {
			return TransactionDispatcher.dispatch( target, code, data, reply, flags );
		}
		finally {
			ConduitContext.restoreCallInfo( previous );
		}
	}


	private void sendReply( @Nonnull Connection conn, int status,
		@Nonnull byte[] payload ) {

		try {
			conn.send( new ReplyIMessage( status, payload ) );
		}
		catch( IOException ex ) {
			LOG.debug( "Unable to send reply on {}", conn, ex );
		}
	}


	/**
	 * Drop one-way calls held for ordering and wake two-way calls waiting on them.
	 */
	void close() {
		oneway_lock.lock();
		try {
			closed = true;
			early_calls.clear();
			oneway_queued.signalAll();
		}
		finally {
			oneway_lock.unlock();
		}
	}


	/**
	 * One-way call waiting in an object's queue. Owns the argument parcel and a
	 * reference to the target.
	 */
	private final class OnewayCall implements SerialExecutionQueue.Task {
		private final LocalObject target;
		private final int code;
		private final Parcel data;

		OnewayCall( LocalObject target, int code, Parcel data ) {
			this.target = target;
			this.code = code;
			this.data = data;
		}

		@Override
		public void run() {
			try( Parcel reply = new Parcel() ) {
				int status = invoke( target, code, data, reply, RemoteObject.FLAG_ONEWAY );
				if ( status != Status.OK ) {
					LOG.debug( "One-way call {} to {} returned {}", code, target,
						Status.toString( status ) );
				}
			}
			finally {
				discard();
			}
		}

		@Override
		public void discard() {
			data.recycle();
			target.release();
		}
	}
}
