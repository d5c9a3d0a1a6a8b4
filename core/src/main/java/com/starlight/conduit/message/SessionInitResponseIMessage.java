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

package com.starlight.conduit.message;

import com.starlight.conduit.Status;


/**
 *
 */
public class SessionInitResponseIMessage implements IMessage {
	private final int status;
	private final byte protocol_version;
	private final long session_id;
	private final int max_threads;


	public SessionInitResponseIMessage( int status, byte protocol_version,
		long session_id, int max_threads ) {

		this.status = status;
		this.protocol_version = protocol_version;
		this.session_id = session_id;
		this.max_threads = max_threads;
	}


	/**
	 * Create a response refusing the connection.
	 */
	public static SessionInitResponseIMessage refuse( int status ) {
		return new SessionInitResponseIMessage( status, ( byte ) 0, 0, 0 );
	}


	@Override
	public IMessageType getType() {
		return IMessageType.SESSION_INIT_RESPONSE;
	}


	public int getStatus() {
		return status;
	}

	public byte getProtocolVersion() {
		return protocol_version;
	}

	public long getSessionID() {
		return session_id;
	}

	/**
	 * The number of threads the accepting side will use to service calls, which is
	 * also the number of connections the opening side should make for the session.
	 */
	public int getMaxThreads() {
		return max_threads;
	}


	@Override
	public String toString() {
		return "SessionInitResponseIMessage{" +
			"status=" + Status.toString( status ) +
			", protocol_version=" + protocol_version +
			", session_id=" + session_id +
			", max_threads=" + max_threads +
			'}';
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		SessionInitResponseIMessage that = ( SessionInitResponseIMessage ) o;

		if ( status != that.status ) return false;
		if ( protocol_version != that.protocol_version ) return false;
		if ( session_id != that.session_id ) return false;
		return max_threads == that.max_threads;
	}

	@Override
	public int hashCode() {
		int result = status;
		result = 31 * result + ( int ) protocol_version;
		result = 31 * result + Long.hashCode( session_id );
		result = 31 * result + max_threads;
		return result;
	}
}
