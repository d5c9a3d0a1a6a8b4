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

import com.starlight.conduit.message.IMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;


public class ParcelTest {
	@Test
	public void primitives() {
		try( Parcel parcel = new Parcel() ) {
			parcel.writeInt( -5 );
			parcel.writeLong( Long.MAX_VALUE );
			parcel.writeBoolean( true );
			parcel.writeString( "héllo" );
			parcel.writeString( null );
			parcel.writeByteArray( new byte[] { 1, 2, 3 } );
			parcel.writeByteArray( null );
			parcel.writeStrongBinder( null );

			assertEquals( 0, parcel.dataPosition() );
			assertEquals( -5, parcel.readInt() );
			assertEquals( Long.MAX_VALUE, parcel.readLong() );
			assertTrue( parcel.readBoolean() );
			assertEquals( "héllo", parcel.readString() );
			assertNull( parcel.readString() );
			assertArrayEquals( new byte[] { 1, 2, 3 }, parcel.readByteArray() );
			assertNull( parcel.readByteArray() );
			assertNull( parcel.readStrongBinder() );
			assertEquals( parcel.dataSize(), parcel.dataPosition() );

			assertThrows( IndexOutOfBoundsException.class, parcel::readInt );
		}
	}


	@Test
	public void dataPosition() {
		try( Parcel parcel = new Parcel() ) {
			parcel.writeInt( 1 );
			parcel.writeInt( 2 );

			parcel.setDataPosition( 4 );
			assertEquals( 2, parcel.readInt() );
			parcel.setDataPosition( 0 );
			assertEquals( 1, parcel.readInt() );

			assertThrows( IndexOutOfBoundsException.class, () -> parcel.setDataPosition( 9 ) );
			assertThrows( IndexOutOfBoundsException.class, () -> parcel.setDataPosition( -1 ) );
		}
	}


	@Test
	public void objectsHeldUntilRecycled() {
		LocalObject object = new LocalObject( "test.Held" );
		Parcel parcel = new Parcel();
		parcel.writeStrongBinder( object );
		parcel.writeStrongBinder( object );
		assertEquals( 3, object.refCnt() );
		assertEquals( 2, parcel.objectCount() );

		assertSame( object, parcel.readStrongBinder() );
		assertSame( object, parcel.readStrongBinder() );

		parcel.recycle();
		assertEquals( 1, object.refCnt() );
		assertEquals( 0, parcel.dataSize() );
		assertEquals( 0, parcel.objectCount() );

		object.release();
	}


	@Test
	public void invalidObjectIndex() {
		try( Parcel parcel = new Parcel() ) {
			parcel.writeInt( 3 );
			assertThrows( IllegalStateException.class, parcel::readStrongBinder );
		}
	}


	@Test
	public void flattenAndUnflatten() throws Exception {
		List<IMessage> sent = new ArrayList<>();
		ObjectTable sender = new ObjectTable( null, message -> {}, null, 10 );
		ObjectTable receiver = new ObjectTable( null, sent::add, null, 10 );

		LocalObject object = new LocalObject( "test.Flatten" );
		byte[] payload;
		try( Parcel parcel = new Parcel() ) {
			parcel.writeInt( 42 );
			parcel.writeStrongBinder( object );
			parcel.writeStrongBinder( null );
			payload = parcel.flatten( sender );
		}
		// Held by the sender's table until the peer acknowledges
		assertEquals( 2, object.refCnt() );

		try( Parcel parcel = new Parcel() ) {
			parcel.unflatten( payload, receiver );
			assertEquals( 42, parcel.readInt() );

			RemoteObject proxy = parcel.readStrongBinder();
			assertTrue( proxy instanceof RemoteProxy );
			assertTrue( proxy.isRemote() );
			assertNull( parcel.readStrongBinder() );
			assertEquals( 1, sent.size() );
		}
		// Recycling released the only proxy reference
		assertEquals( 2, sent.size() );

		object.release();
	}


	@Test
	public void emptyPayload() throws Exception {
		ObjectTable table = new ObjectTable( null, message -> {}, null, 10 );
		try( Parcel parcel = new Parcel() ) {
			parcel.writeInt( 1 );
			parcel.unflatten( new byte[ 0 ], table );
			assertEquals( 0, parcel.dataSize() );
		}
	}


	@Test
	public void malformedPayloads() {
		ObjectTable table = new ObjectTable( null, message -> {}, null, 10 );
		try( Parcel parcel = new Parcel() ) {
			assertStatus( Status.BAD_VALUE, () -> parcel.unflatten( new byte[] { 0, 0 }, table ) );

			// Data length longer than the payload
			assertStatus( Status.BAD_VALUE,
				() -> parcel.unflatten( new byte[] { 0, 0, 0, 9, 0, 0, 0, 0 }, table ) );

			// Object count with no entries
			assertStatus( Status.BAD_VALUE,
				() -> parcel.unflatten( new byte[] { 0, 0, 0, 0, 0, 0, 0, 1 }, table ) );

			// Null object kind
			assertStatus( Status.BAD_VALUE, () -> parcel.unflatten(
				new byte[] { 0, 0, 0, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1 }, table ) );

			// Reference to an object never exported
			assertStatus( Status.INVALID_OPERATION, () -> parcel.unflatten(
				new byte[] { 0, 0, 0, 0, 0, 0, 0, 1, 2, 0, 0, 0, 1 }, table ) );
		}
	}


	@Test
	public void lengthsNearIntegerLimit() {
		ObjectTable table = new ObjectTable( null, message -> {}, null, 10 );
		try( Parcel parcel = new Parcel() ) {
			// Data length of Integer.MAX_VALUE
			assertStatus( Status.BAD_VALUE, () -> parcel.unflatten(
				new byte[] { 0x7F, ( byte ) 0xFF, ( byte ) 0xFF, ( byte ) 0xFF,
					0, 0, 0, 0 }, table ) );

			// 0x33333334 entries of five bytes is 4 in 32-bit arithmetic
			assertStatus( Status.BAD_VALUE, () -> parcel.unflatten(
				new byte[] { 0, 0, 0, 0, 0x33, 0x33, 0x33, 0x34, 1, 0, 0, 0 }, table ) );

			assertEquals( 0, parcel.dataSize() );
		}
		assertEquals( 0, table.countLive() );
	}


	@Test
	public void foreignProxyRejected() throws Exception {
		ObjectTable home = new ObjectTable( null, message -> {}, null, 10 );
		ObjectTable other = new ObjectTable( null, message -> {}, null, 10 );

		RemoteProxy proxy = home.resolveRemote( 4 );
		try( Parcel parcel = new Parcel() ) {
			parcel.writeStrongBinder( proxy );
			assertStatus( Status.INVALID_OPERATION, () -> parcel.flatten( other ) );
		}
		proxy.release();
	}


	private static void assertStatus( int expected, StatusThrowingCall call ) {
		StatusException ex = assertThrows( StatusException.class, call::run );
		assertEquals( expected, ex.getStatus() );
	}

	@FunctionalInterface
	private interface StatusThrowingCall {
		void run() throws StatusException;
	}
}
