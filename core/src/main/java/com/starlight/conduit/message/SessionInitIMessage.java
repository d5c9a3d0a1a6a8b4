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

/**
 * First message sent on every connection by the side that opened it. A session ID of
 * zero requests a new session, otherwise the connection joins an existing session.
 */
public class SessionInitIMessage implements IMessage {
	private final byte min_protocol_version;
	private final byte pref_protocol_version;
	private final long session_id;
	private final boolean reverse;
	private final int max_reverse_threads;


	public SessionInitIMessage( byte min_protocol_version, byte pref_protocol_version,
		long session_id, boolean reverse, int max_reverse_threads ) {

		if ( max_reverse_threads < 0 ) {
			throw new IllegalArgumentException(
				"Invalid reverse thread count: " + max_reverse_threads );
		}

		this.min_protocol_version = min_protocol_version;
		this.pref_protocol_version = pref_protocol_version;
		this.session_id = session_id;
		this.reverse = reverse;
		this.max_reverse_threads = max_reverse_threads;
	}


	@Override
	public IMessageType getType() {
		return IMessageType.SESSION_INIT;
	}


	public byte getMinProtocolVersion() {
		return min_protocol_version;
	}

	public byte getPrefProtocolVersion() {
		return pref_protocol_version;
	}

	public long getSessionID() {
		return session_id;
	}

	/**
	 * If true, the connection is a reverse connection: the side that accepted it will
	 * use it to make calls into the side that opened it.
	 */
	public boolean isReverse() {
		return reverse;
	}

	public int getMaxReverseThreads() {
		return max_reverse_threads;
	}


	@Override
	public String toString() {
		return "SessionInitIMessage{" +
			"min_protocol_version=" + min_protocol_version +
			", pref_protocol_version=" + pref_protocol_version +
			", session_id=" + session_id +
			", reverse=" + reverse +
			", max_reverse_threads=" + max_reverse_threads +
			'}';
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		SessionInitIMessage that = ( SessionInitIMessage ) o;

		if ( min_protocol_version != that.min_protocol_version ) return false;
		if ( pref_protocol_version != that.pref_protocol_version ) return false;
		if ( session_id != that.session_id ) return false;
		if ( reverse != that.reverse ) return false;
		return max_reverse_threads == that.max_reverse_threads;
	}

	@Override
	public int hashCode() {
		int result = ( int ) min_protocol_version;
		result = 31 * result + ( int ) pref_protocol_version;
		result = 31 * result + Long.hashCode( session_id );
		result = 31 * result + ( reverse ? 1 : 0 );
		result = 31 * result + max_reverse_threads;
		return result;
	}
}
