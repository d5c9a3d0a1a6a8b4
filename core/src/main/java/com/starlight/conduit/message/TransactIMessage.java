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

import javax.annotation.Nonnull;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;


/**
 * A call to an object. There is no call ID: the caller owns the connection until the
 * reply arrives, so replies are matched by order.
 * <p>
 * One-way calls to an object are numbered from zero by the sender, per session, so the
 * receiver can run them in order whichever connection carries them. For a two-way call
 * the number is the count of one-way calls sent to the object before it, all of which
 * run before the call does.
 */
public class TransactIMessage implements IMessage {
	public static final int FLAG_ONEWAY = 0x01;

	private final int target_handle;
	private final int code;
	private final int flags;
	private final long oneway_sequence;
	private final int payload_length;
	private final byte[] payload;


	public TransactIMessage( int target_handle, int code, int flags,
		@Nonnull byte[] payload ) {

		this( target_handle, code, flags, 0, payload.length, payload );
	}

	public TransactIMessage( int target_handle, int code, int flags,
		long oneway_sequence, @Nonnull byte[] payload ) {

		this( target_handle, code, flags, oneway_sequence, payload.length, payload );
	}

	public TransactIMessage( int target_handle, int code, int flags,
		long oneway_sequence, int payload_length, @Nonnull byte[] payload ) {

		this.target_handle = target_handle;
		this.code = code;
		this.flags = flags;
		this.oneway_sequence = oneway_sequence;
		this.payload_length = payload_length;
		this.payload = requireNonNull( payload );
	}


	@Override
	public IMessageType getType() {
		return IMessageType.TRANSACT;
	}


	public int getTargetHandle() {
		return target_handle;
	}

	public int getCode() {
		return code;
	}

	public int getFlags() {
		return flags;
	}

	public boolean isOneway() {
		return ( flags & FLAG_ONEWAY ) != 0;
	}

	/**
	 * For a one-way call, its position among the one-way calls to the target. For a
	 * two-way call, the number of one-way calls to the target sent before it.
	 */
	public long getOnewaySequence() {
		return oneway_sequence;
	}

	/**
	 * The declared payload length. This is checked against the actual payload when
	 * the message is encoded.
	 */
	public int getPayloadLength() {
		return payload_length;
	}

	@Nonnull
	public byte[] getPayload() {
		return payload;
	}


	@Override
	public String toString() {
		return "TransactIMessage{" +
			"target_handle=" + target_handle +
			", code=" + code +
			", flags=" + flags +
			", oneway_sequence=" + oneway_sequence +
			", payload_length=" + payload_length +
			'}';
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		TransactIMessage that = ( TransactIMessage ) o;

		if ( target_handle != that.target_handle ) return false;
		if ( code != that.code ) return false;
		if ( flags != that.flags ) return false;
		if ( oneway_sequence != that.oneway_sequence ) return false;
		if ( payload_length != that.payload_length ) return false;
		return Arrays.equals( payload, that.payload );
	}

	@Override
	public int hashCode() {
		int result = target_handle;
		result = 31 * result + code;
		result = 31 * result + flags;
		result = 31 * result + Long.hashCode( oneway_sequence );
		result = 31 * result + payload_length;
		result = 31 * result + Arrays.hashCode( payload );
		return result;
	}
}
