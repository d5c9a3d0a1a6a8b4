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

package com.starlight.conduit.driver;

import okio.Buffer;

import javax.annotation.Nonnull;
import java.io.EOFException;


/**
 * {@link DataSource} and {@link DataSink} backed by an Okio {@link Buffer}.
 */
public class OkioBufferData implements DataSource, DataSink {
	private final Buffer buffer;

	public OkioBufferData( Buffer buffer ) {
		this.buffer = buffer;
	}


	@Override public void put( int value ) {
		buffer.writeByte( value );
	}

	@Override public void putShort( short value ) {
		buffer.writeShort( value );
	}

	@Override public void putInt( int value ) {
		buffer.writeInt( value );
	}

	@Override public void putLong( long value ) {
		buffer.writeLong( value );
	}

	@Override public void put( @Nonnull byte[] b, int offset, int length ) {
		buffer.write( b, offset, length );
	}



	@Override public byte get() throws EOFException {
		return buffer.readByte();
	}

	@Override public short getShort() throws EOFException {
		return buffer.readShort();
	}

	@Override public int getInt() throws EOFException{
		return buffer.readInt();
	}

	@Override public long getLong() throws EOFException {
		return buffer.readLong();
	}

	@Override public void getFully( @Nonnull byte[] destination ) throws EOFException {
		buffer.readFully( destination );
	}

	@Override public boolean request( long byte_count ) {
		return buffer.request( byte_count );
	}
}
