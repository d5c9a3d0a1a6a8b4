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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;


/**
 * Container for transaction arguments and results: a sequence of primitive values
 * plus references to objects.
 * <p>
 * Values are written at the end of the parcel and read from the current data position,
 * which starts at zero. The parcel holds a reference to every object written to or
 * read from it until it is {@link #recycle() recycled}. Objects returned from
 * {@link #readStrongBinder()} belong to the parcel; callers that keep them must
 * {@link RemoteObject#retain() retain} them.
 * <p>
 * Parcels are not thread safe.
 */
public final class Parcel implements AutoCloseable {
	static final byte KIND_NULL = 0;
	static final byte KIND_SENDER_OWNED = 1;
	static final byte KIND_RECEIVER_OWNED = 2;

	private static final int NULL_INDEX = -1;

	private final ByteBuf data = Unpooled.buffer( 64 );
	private final List<RemoteObject> objects = new ArrayList<>();


	public void writeInt( int value ) {
		data.writeInt( value );
	}

	public void writeLong( long value ) {
		data.writeLong( value );
	}

	public void writeBoolean( boolean value ) {
		data.writeInt( value ? 1 : 0 );
	}

	/**
	 * Write a string, which may be null.
	 */
	public void writeString( @Nullable String value ) {
		if ( value == null ) {
			data.writeInt( -1 );
			return;
		}

		byte[] bytes = value.getBytes( StandardCharsets.UTF_8 );
		data.writeInt( bytes.length );
		data.writeBytes( bytes );
	}

	/**
	 * Write a byte array, which may be null.
	 */
	public void writeByteArray( @Nullable byte[] value ) {
		if ( value == null ) {
			data.writeInt( -1 );
			return;
		}

		data.writeInt( value.length );
		data.writeBytes( value );
	}

	/**
	 * Write an object reference, which may be null. The parcel retains the object.
	 */
	public void writeStrongBinder( @Nullable RemoteObject object ) {
		if ( object == null ) {
			data.writeInt( NULL_INDEX );
			return;
		}

		objects.add( object.retain() );
		data.writeInt( objects.size() - 1 );
	}


	public int readInt() {
		checkReadable( 4 );
		return data.readInt();
	}

	public long readLong() {
		checkReadable( 8 );
		return data.readLong();
	}

	public boolean readBoolean() {
		return readInt() != 0;
	}

	@Nullable
	public String readString() {
		byte[] bytes = readByteArray();
		if ( bytes == null ) return null;
		return new String( bytes, StandardCharsets.UTF_8 );
	}

	@Nullable
	public byte[] readByteArray() {
		int length = readInt();
		if ( length < 0 ) return null;

		checkReadable( length );
		byte[] bytes = new byte[ length ];
		data.readBytes( bytes );
		return bytes;
	}

	/**
	 * Read an object reference. The returned object belongs to the parcel.
	 *
	 * @throws IllegalStateException	If the data at the current position is not an
	 * 									object reference.
	 */
	@Nullable
	public RemoteObject readStrongBinder() {
		int index = readInt();
		if ( index == NULL_INDEX ) return null;
		if ( index < 0 || index >= objects.size() ) {
			throw new IllegalStateException( "Invalid object index: " + index );
		}
		return objects.get( index );
	}


	/**
	 * Size of the primitive data, in bytes.
	 */
	public int dataSize() {
		return data.writerIndex();
	}

	public int dataPosition() {
		return data.readerIndex();
	}

	public void setDataPosition( int position ) {
		if ( position < 0 || position > data.writerIndex() ) {
			throw new IndexOutOfBoundsException( "Invalid position: " + position );
		}
		data.readerIndex( position );
	}

	public int objectCount() {
		return objects.size();
	}


	/**
	 * Empty the parcel, releasing any objects it holds. The parcel can be reused
	 * afterwards.
	 */
	public void recycle() {
		data.clear();

		// Copy first: releasing a proxy can run arbitrary code
		List<RemoteObject> to_release = new ArrayList<>( objects );
		objects.clear();
		to_release.forEach( RemoteObject::release );
	}

	@Override
	public void close() {
		recycle();
	}


	/**
	 * Produce the wire form of the parcel for sending on a session. Local objects are
	 * exported through the session's object table.
	 *
	 * @throws StatusException	{@link Status#INVALID_OPERATION} if the parcel holds a
	 * 							proxy belonging to another session.
	 */
	byte[] flatten( @Nonnull ObjectTable table ) throws StatusException {
		// Validate everything before exporting anything so a failure leaves no
		// outstanding sends in the table.
		for( RemoteObject object : objects ) {
			if ( object instanceof RemoteProxy ) {
				table.handleForProxy( ( RemoteProxy ) object );
			}
			else if ( object instanceof LocalObject ) {
				if ( object.refCnt() <= 0 ) {
					throw new StatusException( Status.DEAD_OBJECT,
						"Object has been destroyed: " + object );
				}
			}
			else {
				throw new StatusException( Status.INVALID_OPERATION,
					"Unsupported object type: " + object.getClass().getName() );
			}
		}

		int data_length = data.writerIndex();
		ByteBuf out = Unpooled.buffer( 8 + data_length + objects.size() * 5 );
		try {
			out.writeInt( data_length );
			out.writeBytes( data, 0, data_length );
			out.writeInt( objects.size() );
			for( RemoteObject object : objects ) {
				if ( object instanceof RemoteProxy ) {
					out.writeByte( KIND_RECEIVER_OWNED );
					out.writeInt( ( ( RemoteProxy ) object ).getHandle() );
				}
				else {
					out.writeByte( KIND_SENDER_OWNED );
					out.writeInt( table.prepareSend( ( LocalObject ) object ) );
				}
			}

			byte[] bytes = new byte[ out.readableBytes() ];
			out.readBytes( bytes );
			return bytes;
		}
		finally {
			out.release();
		}
	}


	/**
	 * Replace the contents of the parcel with a payload received on a session. Every
	 * object reference is resolved, even when an earlier one fails, so that the
	 * owner's counts stay balanced.
	 *
	 * @throws StatusException	{@link Status#BAD_VALUE} for a malformed payload or
	 * 							{@link Status#INVALID_OPERATION} for a reference to an
	 * 							object not exported on the session.
	 */
	void unflatten( @Nonnull byte[] payload, @Nonnull ObjectTable table )
		throws StatusException {

		requireNonNull( payload );
		recycle();

		// An empty payload is an empty parcel
		if ( payload.length == 0 ) return;

		ByteBuf in = Unpooled.wrappedBuffer( payload );
		if ( in.readableBytes() < 4 ) {
			throw new StatusException( Status.BAD_VALUE, "Payload too short" );
		}
		int data_length = in.readInt();
		// Written so that no length near Integer.MAX_VALUE can overflow
		if ( data_length < 0 || data_length > in.readableBytes() - 4 ) {
			throw new StatusException( Status.BAD_VALUE,
				"Invalid data length: " + data_length );
		}
		data.writeBytes( in, data_length );

		int object_count = in.readInt();
		if ( object_count < 0 || object_count > in.readableBytes() / 5 ||
			in.readableBytes() != object_count * 5 ) {

			data.clear();
			throw new StatusException( Status.BAD_VALUE,
				"Invalid object count: " + object_count );
		}

		StatusException failure = null;
		for( int i = 0; i < object_count; i++ ) {
			byte kind = in.readByte();
			int handle = in.readInt();

			try {
				switch( kind ) {
					case KIND_SENDER_OWNED:
						objects.add( table.resolveRemote( handle ) );
						break;

					case KIND_RECEIVER_OWNED:
						objects.add( table.lookupLocal( handle ) );
						break;

					case KIND_NULL:
						throw new StatusException( Status.BAD_VALUE,
							"Null object entry" );

					default:
						throw new StatusException( Status.BAD_VALUE,
							"Unknown object kind: " + kind );
				}
			}
			catch( StatusException ex ) {
				if ( failure == null ) failure = ex;
			}
		}

		if ( failure != null ) {
			recycle();
			throw failure;
		}
	}


	private void checkReadable( int length ) {
		if ( data.readableBytes() < length ) {
			throw new IndexOutOfBoundsException( "Attempt to read " + length +
				" bytes with " + data.readableBytes() + " remaining" );
		}
	}


	@Override
	public String toString() {
		return "Parcel{" +
			"data_size=" + data.writerIndex() +
			", position=" + data.readerIndex() +
			", objects=" + objects.size() +
			'}';
	}
}
