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

import io.netty.util.AbstractReferenceCounted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;


/**
 * An object living in this process which can be sent to peers. Transactions on the
 * object are handled by the {@link TransactionHandler} registered for its class in
 * its {@link HandlerRegistry}.
 * <p>
 * The creator holds the initial reference. Each session the object has been sent to
 * holds an additional reference while the peer has strong interest in it.
 */
public class LocalObject extends AbstractReferenceCounted implements RemoteObject {
	private static final Logger LOG = LoggerFactory.getLogger( LocalObject.class );

	private final String descriptor;
	private final HandlerRegistry registry;

	private final List<Runnable> destroy_listeners = new CopyOnWriteArrayList<>();


	public LocalObject( @Nonnull String descriptor ) {
		this( descriptor, HandlerRegistry.global() );
	}

	public LocalObject( @Nonnull String descriptor, @Nonnull HandlerRegistry registry ) {
		this.descriptor = requireNonNull( descriptor );
		this.registry = requireNonNull( registry );
	}


	@Override
	public int transact( int code, @Nonnull Parcel data, @Nullable Parcel reply,
		int flags ) {

		if ( refCnt() <= 0 ) return Status.DEAD_OBJECT;

		data.setDataPosition( 0 );
		Parcel actual_reply = reply == null ? new Parcel() : reply;
		try {
			int status = TransactionDispatcher.dispatch( this, code, data, actual_reply,
				flags );
			actual_reply.setDataPosition( 0 );
			return status;
		}
		finally {
			if ( reply == null ) actual_reply.recycle();
		}
	}


	@Nonnull
	@Override
	public String getInterfaceDescriptor() {
		return descriptor;
	}


	@Override
	public boolean isRemote() {
		return false;
	}


	@Nonnull
	public HandlerRegistry getRegistry() {
		return registry;
	}


	/**
	 * Add a listener to be notified when the object is destroyed.
	 */
	public void addDestroyListener( @Nonnull Runnable listener ) {
		destroy_listeners.add( requireNonNull( listener ) );
	}


	/**
	 * Called when the last reference to the object has been released. Subclasses may
	 * override to free resources.
	 */
	protected void onDestroy() {}


	@Override
	protected final void deallocate() {
		LOG.trace( "Object destroyed: {}", this );

		try {
			onDestroy();
		}
		finally {
			for( Runnable listener : destroy_listeners ) {
				try {
					listener.run();
				}
				catch( RuntimeException ex ) {
					LOG.warn( "Destroy listener threw an exception: {}", listener, ex );
				}
			}
		}
	}


	@Override
	public LocalObject retain() {
		super.retain();
		return this;
	}

	@Override
	public LocalObject retain( int increment ) {
		super.retain( increment );
		return this;
	}

	@Override
	public LocalObject touch() {
		return this;
	}

	@Override
	public LocalObject touch( Object hint ) {
		return this;
	}


	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + descriptor + "@" +
			Integer.toHexString( System.identityHashCode( this ) ) + "}";
	}
}
