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

import com.starlight.conduit.message.AcquireIMessage;
import com.starlight.conduit.message.IMessage;
import com.starlight.conduit.message.ReleaseIMessage;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TCustomHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.strategy.IdentityHashingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;


/**
 * Per-session map between objects and the handles that name them on the wire.
 * <p>
 * For local objects the table tracks the interest the peer has in each object:
 * <ul>
 *     <li><b>in flight</b>: sends of the object not yet acknowledged by the peer</li>
 *     <li><b>strong</b>: live proxies the peer holds (zero or one per proxy generation)</li>
 *     <li><b>weak</b>: weak interest registered by the peer</li>
 * </ul>
 * The table holds a reference to the object while any strong or in-flight interest
 * remains and forgets the handle when all three counts reach zero. The counts are only
 * ever adjusted by additions and subtractions, so control messages arriving on
 * different connections may be applied in any order.
 * <p>
 * For remote objects the table keeps at most one live proxy per handle.
 */
final class ObjectTable {
	private static final Logger LOG = LoggerFactory.getLogger( ObjectTable.class );

	private final ConduitSession session;
	private final Consumer<IMessage> control_sender;
	private final Executor oneway_executor;
	private final int oneway_capacity;

	private final Lock lock = new ReentrantLock();

	private final TIntObjectMap<LocalEntry> local_by_handle = new TIntObjectHashMap<>();
	private final Map<LocalObject,LocalEntry> local_by_object =
		new TCustomHashMap<>( new IdentityHashingStrategy<>() );
	private final TIntObjectMap<RemoteEntry> remote_by_handle = new TIntObjectHashMap<>();

	// Handle zero names the session itself
	private int next_handle = 1;
	private boolean closed = false;


	/**
	 * @param session				Session proxies created by the table make their
	 * 								calls through.
	 * @param control_sender		Sends control messages to the peer. Never called
	 * 								with the table lock held.
	 * @param oneway_executor		Executor for one-way call queues. If null, one-way
	 * 								calls run on the thread that receives them.
	 * @param oneway_capacity		Maximum pending one-way calls per object.
	 */
	ObjectTable( @Nonnull ConduitSession session, @Nonnull Consumer<IMessage> control_sender,
		@Nullable Executor oneway_executor, int oneway_capacity ) {

		this.session = session;
		this.control_sender = control_sender;
		this.oneway_executor = oneway_executor;
		this.oneway_capacity = oneway_capacity;
	}


	/**
	 * Get the handle for a local object, assigning one if it has none. This does not
	 * change any counts.
	 */
	int exposeLocal( @Nonnull LocalObject object ) throws StatusException {
		lock.lock();
		try {
			return findOrCreateLocal( object ).handle;
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Get the handle for a local object which is about to be sent to the peer and
	 * count the send as in flight.
	 */
	int prepareSend( @Nonnull LocalObject object ) throws StatusException {
		lock.lock();
		try {
			LocalEntry entry = findOrCreateLocal( object );
			entry.in_flight++;
			if ( !entry.pinned ) {
				if ( !Conduit.tryRetain( object ) ) {
					entry.in_flight--;
					removeIfUnused( entry );
					throw new StatusException( Status.DEAD_OBJECT,
						"Object has been destroyed: " + object );
				}
				entry.pinned = true;
			}
			return entry.handle;
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Verify a proxy may be sent on this session.
	 */
	int handleForProxy( @Nonnull RemoteProxy proxy ) throws StatusException {
		if ( proxy.getObjectTable() != this ) {
			throw new StatusException( Status.INVALID_OPERATION,
				"Proxy belongs to a different session: " + proxy );
		}
		if ( proxy.refCnt() <= 0 ) {
			throw new StatusException( Status.INVALID_OPERATION,
				"Proxy has been released: " + proxy );
		}
		return proxy.getHandle();
	}


	/**
	 * Resolve a handle sent by the peer for one of its objects.
	 *
	 * @return		A proxy with a reference owned by the caller.
	 */
	@Nonnull
	RemoteProxy resolveRemote( int handle ) throws StatusException {
		if ( handle <= 0 ) {
			throw new StatusException( Status.BAD_VALUE, "Invalid handle: " + handle );
		}

		RemoteProxy proxy;
		lock.lock();
		try {
			checkOpen();

			RemoteEntry entry = remote_by_handle.get( handle );
			if ( entry != null && entry.proxy != null && Conduit.tryRetain( entry.proxy ) ) {
				entry.proxy.unacknowledged_receipts++;
				return entry.proxy;
			}

			if ( entry == null ) {
				entry = new RemoteEntry( handle );
				remote_by_handle.put( handle, entry );
			}
			proxy = new RemoteProxy( session, this, handle );
			entry.proxy = proxy;
		}
		finally {
			lock.unlock();
		}

		control_sender.accept( new AcquireIMessage( handle, false, 1 ) );
		return proxy;
	}


	/**
	 * Resolve a handle sent by the peer for one of our own objects.
	 *
	 * @return		The object with a reference owned by the caller.
	 */
	@Nonnull
	LocalObject lookupLocal( int handle ) throws StatusException {
		lock.lock();
		try {
			checkOpen();

			LocalEntry entry = local_by_handle.get( handle );
			if ( entry == null || !Conduit.tryRetain( entry.object ) ) {
				throw new StatusException( Status.INVALID_OPERATION,
					"Handle " + handle + " is not valid on this session" );
			}
			return entry.object;
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Find the object a transaction is addressed to.
	 *
	 * @return		The target, whose object reference is owned by the caller.
	 */
	@Nonnull
	Target lookupTarget( int handle ) throws StatusException {
		lock.lock();
		try {
			if ( closed ) {
				throw new StatusException( Status.DEAD_OBJECT, "Session is closed" );
			}

			LocalEntry entry = local_by_handle.get( handle );
			if ( entry == null ) {
				throw new StatusException( Status.INVALID_OPERATION,
					"Handle " + handle + " is not valid on this session" );
			}
			if ( !Conduit.tryRetain( entry.object ) ) {
				throw new StatusException( Status.DEAD_OBJECT,
					"Object for handle " + handle + " has been destroyed" );
			}

			if ( entry.oneway_queue == null ) {
				entry.oneway_queue =
					new SerialExecutionQueue( oneway_executor, oneway_capacity );
			}
			return new Target( entry.object, entry.oneway_queue );
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Apply an acquire message from the peer.
	 */
	void acquired( int handle, boolean weak, int count ) {
		applyRemoteChange( handle, weak, count, true );
	}


	/**
	 * Apply a release message from the peer.
	 */
	void released( int handle, boolean weak, int count ) {
		applyRemoteChange( handle, weak, count, false );
	}


	/**
	 * Called when the last local reference to a proxy is released.
	 */
	void proxyReleased( @Nonnull RemoteProxy proxy ) {
		int receipts;
		lock.lock();
		try {
			if ( closed ) return;

			receipts = proxy.unacknowledged_receipts;
			RemoteEntry entry = remote_by_handle.get( proxy.getHandle() );
			if ( entry != null && entry.proxy == proxy ) {
				entry.proxy = null;
				if ( entry.weak == 0 ) remote_by_handle.remove( proxy.getHandle() );
			}
		}
		finally {
			lock.unlock();
		}

		control_sender.accept( new ReleaseIMessage( proxy.getHandle(), false, receipts ) );
	}


	/**
	 * Register local weak interest in a proxy.
	 */
	void acquireWeak( @Nonnull RemoteProxy proxy ) {
		boolean first;
		lock.lock();
		try {
			if ( closed ) return;

			RemoteEntry entry = remote_by_handle.get( proxy.getHandle() );
			if ( entry == null ) return;

			entry.weak++;
			first = entry.weak == 1;
		}
		finally {
			lock.unlock();
		}

		if ( first ) {
			control_sender.accept( new AcquireIMessage( proxy.getHandle(), true, 1 ) );
		}
	}


	void releaseWeak( int handle ) {
		boolean last;
		lock.lock();
		try {
			if ( closed ) return;

			RemoteEntry entry = remote_by_handle.get( handle );
			if ( entry == null || entry.weak == 0 ) return;

			entry.weak--;
			last = entry.weak == 0;
			if ( last && entry.proxy == null ) remote_by_handle.remove( handle );
		}
		finally {
			lock.unlock();
		}

		if ( last ) control_sender.accept( new ReleaseIMessage( handle, true, 1 ) );
	}


	/**
	 * Number of entries in which the table or the peer still has interest.
	 */
	int countLive() {
		lock.lock();
		try {
			int count = remote_by_handle.size();
			for( LocalEntry entry : local_by_handle.valueCollection() ) {
				if ( entry.isUsed() ) count++;
			}
			return count;
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Drop every entry. References held on behalf of the peer are released and queued
	 * one-way calls are discarded. Later lookups fail with {@link Status#DEAD_OBJECT}.
	 */
	void close() {
		List<LocalObject> to_release = new ArrayList<>();
		List<SerialExecutionQueue> queues = new ArrayList<>();
		lock.lock();
		try {
			if ( closed ) return;
			closed = true;

			for( LocalEntry entry : local_by_handle.valueCollection() ) {
				if ( entry.pinned ) to_release.add( entry.object );
				if ( entry.oneway_queue != null ) queues.add( entry.oneway_queue );
			}
			local_by_handle.clear();
			local_by_object.clear();
			remote_by_handle.clear();
		}
		finally {
			lock.unlock();
		}

		queues.forEach( SerialExecutionQueue::close );
		for( LocalObject object : to_release ) {
			try {
				object.release();
			}
			catch( RuntimeException ex ) {
				LOG.warn( "Error releasing {} during session close", object, ex );
			}
		}
	}


	boolean isClosed() {
		lock.lock();
		try {
			return closed;
		}
		finally {
			lock.unlock();
		}
	}


	private LocalEntry findOrCreateLocal( LocalObject object ) throws StatusException {
		checkOpen();

		LocalEntry entry = local_by_object.get( object );
		if ( entry == null ) {
			if ( object.refCnt() <= 0 ) {
				throw new StatusException( Status.DEAD_OBJECT,
					"Object has been destroyed: " + object );
			}

			entry = new LocalEntry( next_handle++, object );
			local_by_object.put( object, entry );
			local_by_handle.put( entry.handle, entry );
			LOG.trace( "Exposed {} as handle {}", object, entry.handle );
		}
		return entry;
	}


	private void applyRemoteChange( int handle, boolean weak, int count, boolean add ) {
		LocalObject to_release = null;
		lock.lock();
		try {
			if ( closed ) return;

			LocalEntry entry = local_by_handle.get( handle );
			if ( entry == null ) {
				LOG.debug( "Peer {} unknown handle {}", add ? "acquired" : "released",
					handle );
				return;
			}

			if ( weak ) {
				entry.weak += add ? 1 : -1;
			}
			else {
				entry.in_flight -= count;
				entry.strong += add ? 1 : -1;
			}

			// Counts may dip below zero while an acquire is still in transit on another
			// connection
			if ( entry.pinned && entry.strong <= 0 && entry.in_flight <= 0 ) {
				entry.pinned = false;
				to_release = entry.object;
			}
			removeIfUnused( entry );
		}
		finally {
			lock.unlock();
		}

		if ( to_release != null ) to_release.release();
	}


	private void removeIfUnused( LocalEntry entry ) {
		if ( entry.isUsed() ) return;

		local_by_handle.remove( entry.handle );
		local_by_object.remove( entry.object );
		LOG.trace( "Handle {} removed", entry.handle );
	}


	private void checkOpen() throws StatusException {
		if ( closed ) throw new StatusException( Status.DEAD_OBJECT, "Session is closed" );
	}


	/**
	 * An object which is the target of a transaction, with its one-way queue.
	 */
	static final class Target {
		final LocalObject object;
		final SerialExecutionQueue oneway_queue;

		Target( LocalObject object, SerialExecutionQueue oneway_queue ) {
			this.object = object;
			this.oneway_queue = oneway_queue;
		}
	}


	private static final class LocalEntry {
		final int handle;
		final LocalObject object;

		int in_flight;
		int strong;
		int weak;
		boolean pinned;
		SerialExecutionQueue oneway_queue;

		LocalEntry( int handle, LocalObject object ) {
			this.handle = handle;
			this.object = object;
		}

		boolean isUsed() {
			return in_flight != 0 || strong != 0 || weak != 0;
		}
	}


	private static final class RemoteEntry {
		final int handle;
		RemoteProxy proxy;
		int weak;

		RemoteEntry( int handle ) {
			this.handle = handle;
		}
	}
}
