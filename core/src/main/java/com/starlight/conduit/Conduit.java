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


/**
 * Static helpers for working with objects that may be absent.
 */
public final class Conduit {
	private Conduit() {}


	/**
	 * Perform a transaction on an object which may be null.
	 *
	 * @return		{@link Status#UNEXPECTED_NULL} if the target is null, otherwise the
	 * 				result of {@link RemoteObject#transact}.
	 */
	public static int transact( @Nullable RemoteObject target, int code,
		@Nonnull Parcel data, @Nullable Parcel reply, int flags ) {

		if ( target == null ) return Status.UNEXPECTED_NULL;
		return target.transact( code, data, reply, flags );
	}


	/**
	 * Ping an object which may be null.
	 */
	public static int ping( @Nullable RemoteObject target ) {
		if ( target == null ) return Status.UNEXPECTED_NULL;
		return target.ping();
	}


	/**
	 * Release an object, if non-null.
	 */
	public static void release( @Nullable RemoteObject object ) {
		if ( object != null ) object.release();
	}


	/**
	 * Attempt to add a reference to an object whose count may already have reached
	 * zero.
	 *
	 * @return		True if a reference was added.
	 */
	static boolean tryRetain( @Nonnull RemoteObject object ) {
		if ( object.refCnt() <= 0 ) return false;
		try {
			object.retain();
			return true;
		}
		catch( io.netty.util.IllegalReferenceCountException ex ) {
			// Lost a race with the final release
			return false;
		}
	}
}
