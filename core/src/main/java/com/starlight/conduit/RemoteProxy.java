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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;


/**
 * Local stand-in for an object owned by the peer of a session. A session keeps at most
 * one live proxy per handle, so two proxies for the same remote object are the same
 * instance.
 */
public final class RemoteProxy extends AbstractReferenceCounted implements RemoteObject {
	private final ConduitSession session;
	private final ObjectTable table;
	private final int handle;

	// Number of times the object was received, beyond the first, since the proxy was
	// created. Reported to the owner on release. Guarded by the object table lock.
	int unacknowledged_receipts = 0;

	private volatile String descriptor;


	RemoteProxy( @Nonnull ConduitSession session, @Nonnull ObjectTable table, int handle ) {
		this.session = session;
		this.table = table;
		this.handle = handle;
	}


	@Override
	public int transact( int code, @Nonnull Parcel data, @Nullable Parcel reply,
		int flags ) {

		if ( refCnt() <= 0 ) return Status.INVALID_OPERATION;
		return session.transact( handle, code, data, reply, flags );
	}


	/**
	 * Fetches the descriptor from the remote object on first use.
	 */
	@Nullable
	@Override
	public String getInterfaceDescriptor() {
		String value = descriptor;
		if ( value != null ) return value;

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			int status = transact( INTERFACE_TRANSACTION, data, reply, 0 );
			if ( status != Status.OK ) return null;

			value = reply.readString();
			descriptor = value;
			return value;
		}
	}


	@Override
	public boolean isRemote() {
		return true;
	}


	@Nonnull
	public ConduitSession getSession() {
		return session;
	}

	public int getHandle() {
		return handle;
	}


	ObjectTable getObjectTable() {
		return table;
	}


	@Override
	protected void deallocate() {
		table.proxyReleased( this );
	}


	@Override
	public RemoteProxy retain() {
		super.retain();
		return this;
	}

	@Override
	public RemoteProxy retain( int increment ) {
		super.retain( increment );
		return this;
	}

	@Override
	public RemoteProxy touch() {
		return this;
	}

	@Override
	public RemoteProxy touch( Object hint ) {
		return this;
	}


	@Override
	public String toString() {
		return "RemoteProxy{" +
			"session=" + Long.toHexString( session.getSessionID() ) +
			", handle=" + handle +
			'}';
	}
}
