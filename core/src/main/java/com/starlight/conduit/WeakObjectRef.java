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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;


/**
 * A reference that does not keep its object alive. For a proxy, weak interest is also
 * registered with the object's owner.
 * <p>
 * A weak reference can only be promoted while some strong reference to the object
 * still exists. Once the last strong reference is released, {@link #promote()} returns
 * null even if the owner is still holding the object.
 */
public final class WeakObjectRef {
	private final RemoteObject object;
	private final AtomicBoolean released = new AtomicBoolean();


	private WeakObjectRef( RemoteObject object ) {
		this.object = object;
	}


	/**
	 * Create a weak reference to an object. The caller must hold a strong reference
	 * while doing so.
	 */
	public static WeakObjectRef of( @Nonnull RemoteObject object ) {
		requireNonNull( object );
		if ( object.refCnt() <= 0 ) {
			throw new IllegalStateException( "Object has already been destroyed: " + object );
		}

		if ( object instanceof RemoteProxy ) {
			RemoteProxy proxy = ( RemoteProxy ) object;
			proxy.getObjectTable().acquireWeak( proxy );
		}
		return new WeakObjectRef( object );
	}


	/**
	 * Obtain a strong reference, which the caller must release.
	 *
	 * @return		The object or null if no strong references remain.
	 */
	@Nullable
	public RemoteObject promote() {
		if ( released.get() ) return null;
		if ( Conduit.tryRetain( object ) ) return object;
		return null;
	}


	/**
	 * Drop the weak interest. Calling this more than once has no effect.
	 */
	public void release() {
		if ( !released.compareAndSet( false, true ) ) return;

		if ( object instanceof RemoteProxy ) {
			RemoteProxy proxy = ( RemoteProxy ) object;
			proxy.getObjectTable().releaseWeak( proxy.getHandle() );
		}
	}


	@Override
	public String toString() {
		return "WeakObjectRef{" + object + '}';
	}
}
