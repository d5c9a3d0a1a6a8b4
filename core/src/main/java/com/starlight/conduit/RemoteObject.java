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

import com.starlight.conduit.message.TransactIMessage;
import io.netty.util.ReferenceCounted;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;


/**
 * An object that can receive transactions, either locally ({@link LocalObject}) or
 * in another process ({@link RemoteProxy}).
 * <p>
 * Objects are reference counted. The holder of a reference must
 * {@link #release() release} it when done. When the last reference to a local object
 * is released (locally and by every peer it was sent to) the object is destroyed.
 */
public interface RemoteObject extends ReferenceCounted {
	int FIRST_CALL_TRANSACTION = 0x00000001;
	int LAST_CALL_TRANSACTION = 0x00ffffff;

	/** Liveness probe. Handled by the transport without reaching any handler. */
	int PING_TRANSACTION = ( '_' << 24 ) | ( 'P' << 16 ) | ( 'N' << 8 ) | 'G';
	/** Replies with the object's interface descriptor. */
	int INTERFACE_TRANSACTION = ( '_' << 24 ) | ( 'N' << 16 ) | ( 'T' << 8 ) | 'F';

	/** Flag indicating the call should not wait for (or receive) a reply. */
	int FLAG_ONEWAY = TransactIMessage.FLAG_ONEWAY;


	/**
	 * Perform a transaction on the object.
	 *
	 * @param code		Selector for the operation.
	 * @param data		Arguments. The parcel is not modified, other than its read
	 * 					position.
	 * @param reply		Parcel the result is written to. May be null if the result
	 * 					is not wanted. Ignored for one-way calls.
	 * @param flags		Zero or {@link #FLAG_ONEWAY}.
	 *
	 * @return			A {@link Status} code or an application-defined status.
	 */
	int transact( int code, @Nonnull Parcel data, @Nullable Parcel reply, int flags );


	/**
	 * The interface descriptor of the object, or null if it could not be determined.
	 */
	@Nullable String getInterfaceDescriptor();


	/**
	 * True if the object lives in another process.
	 */
	boolean isRemote();


	default int ping() {
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			return transact( PING_TRANSACTION, data, reply, 0 );
		}
	}


	@Override RemoteObject retain();

	@Override RemoteObject retain( int increment );

	@Override RemoteObject touch();

	@Override RemoteObject touch( Object hint );
}
