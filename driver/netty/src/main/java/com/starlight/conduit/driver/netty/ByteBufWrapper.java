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

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.driver.DataSink;
import com.starlight.conduit.driver.DataSource;
import io.netty.buffer.ByteBuf;

import javax.annotation.Nonnull;
import java.io.EOFException;


/**
 * Adapts a {@link ByteBuf} to the codec's {@link DataSource} and {@link DataSink}.
 */
class ByteBufWrapper implements DataSource, DataSink {
	private final ByteBuf delegate;


	ByteBufWrapper( @Nonnull ByteBuf delegate ) {
		this.delegate = delegate;
	}


	@Override
	public byte get() throws EOFException {
		checkReadable( 1 );
		return delegate.readByte();
	}

	@Override
	public short getShort() throws EOFException {
		checkReadable( 2 );
		return delegate.readShort();
	}

	@Override
	public int getInt() throws EOFException {
		checkReadable( 4 );
		return delegate.readInt();
	}

	@Override
	public long getLong() throws EOFException {
		checkReadable( 8 );
		return delegate.readLong();
	}

	@Override
	public void getFully( @Nonnull byte[] destination ) throws EOFException {
		checkReadable( destination.length );
		delegate.readBytes( destination );
	}

	@Override
	public boolean request( long byte_count ) {
		return delegate.readableBytes() >= byte_count;
	}



	@Override
	public void put( int value ) {
		delegate.writeByte( value );
	}

	@Override
	public void putShort( short value ) {
		delegate.writeShort( value );
	}

	@Override
	public void putInt( int value ) {
		delegate.writeInt( value );
	}

	@Override
	public void putLong( long value ) {
		delegate.writeLong( value );
	}

	@Override
	public void put( @Nonnull byte[] b, int offset, int length ) {
		delegate.writeBytes( b, offset, length );
	}

	@Override
	public void prepareForData( int length ) {
		delegate.ensureWritable( length );
	}



	private void checkReadable( int length ) throws EOFException {
		if ( delegate.readableBytes() < length ) {
			throw new EOFException( "Needed " + length + " bytes, " +
				delegate.readableBytes() + " available" );
		}
	}


	@Override
	public String toString() {
		return delegate.toString();
	}
}
