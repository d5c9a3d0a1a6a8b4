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

import javax.annotation.Nonnull;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;


/**
 *
 */
public class ReplyIMessage implements IMessage {
	private static final byte[] EMPTY = new byte[ 0 ];

	private final int status;
	private final int payload_length;
	private final byte[] payload;


	public ReplyIMessage( int status ) {
		this( status, EMPTY );
	}

	public ReplyIMessage( int status, @Nonnull byte[] payload ) {
		this( status, payload.length, payload );
	}

	public ReplyIMessage( int status, int payload_length, @Nonnull byte[] payload ) {
		this.status = status;
		this.payload_length = payload_length;
		this.payload = requireNonNull( payload );
	}


	@Override
	public IMessageType getType() {
		return IMessageType.REPLY;
	}


	public int getStatus() {
		return status;
	}

	public int getPayloadLength() {
		return payload_length;
	}

	@Nonnull
	public byte[] getPayload() {
		return payload;
	}


	@Override
	public String toString() {
		return "ReplyIMessage{" +
			"status=" + Status.toString( status ) +
			", payload_length=" + payload_length +
			'}';
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		ReplyIMessage that = ( ReplyIMessage ) o;

		if ( status != that.status ) return false;
		if ( payload_length != that.payload_length ) return false;
		return Arrays.equals( payload, that.payload );
	}

	@Override
	public int hashCode() {
		int result = status;
		result = 31 * result + payload_length;
		result = 31 * result + Arrays.hashCode( payload );
		return result;
	}
}
