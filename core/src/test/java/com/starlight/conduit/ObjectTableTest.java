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

import com.starlight.conduit.message.AcquireIMessage;
import com.starlight.conduit.message.IMessage;
import com.starlight.conduit.message.ReleaseIMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;


public class ObjectTableTest {
	private List<IMessage> sent;
	private ObjectTable table;


	@BeforeEach
	public void setUp() {
		sent = new ArrayList<>();
		table = new ObjectTable( null, sent::add, null, 10 );
	}


	@Test
	public void sendPinsUntilAcquiredAndReleased() throws Exception {
		LocalObject object = new LocalObject( "test.Pinned" );

		int handle = table.prepareSend( object );
		assertTrue( handle > 0 );
		assertEquals( 2, object.refCnt() );
		assertEquals( 1, table.countLive() );

		// The creator lets go but the peer still has the object in flight
		object.release();
		assertEquals( 1, object.refCnt() );

		table.acquired( handle, false, 1 );
		assertEquals( 1, object.refCnt() );

		table.released( handle, false, 0 );
		assertEquals( 0, object.refCnt() );
		assertEquals( 0, table.countLive() );
	}


	@Test
	public void releaseBeforeAcquire() throws Exception {
		LocalObject object = new LocalObject( "test.Reorder" );
		int handle = table.prepareSend( object );
		int second = table.prepareSend( object );
		assertEquals( handle, second );

		// The peer received the object twice: acquire for the first receipt, release
		// covering the second. The release overtakes the acquire.
		table.released( handle, false, 1 );
		assertEquals( 2, object.refCnt() );

		table.acquired( handle, false, 1 );
		assertEquals( 1, object.refCnt() );
		assertEquals( 0, table.countLive() );

		object.release();
	}


	@Test
	public void handleReusedWhileExposed() throws Exception {
		LocalObject object = new LocalObject( "test.Stable" );
		int handle = table.exposeLocal( object );
		assertEquals( handle, table.exposeLocal( object ) );

		LocalObject other = new LocalObject( "test.Other" );
		assertNotEquals( handle, table.exposeLocal( other ) );

		object.release();
		other.release();
	}


	@Test
	public void resolveRemoteSendsAcquire() throws Exception {
		RemoteProxy first = table.resolveRemote( 7 );
		assertEquals( List.of( new AcquireIMessage( 7, false, 1 ) ), sent );
		sent.clear();

		RemoteProxy second = table.resolveRemote( 7 );
		assertSame( first, second );
		assertTrue( sent.isEmpty() );

		first.release();
		assertTrue( sent.isEmpty() );
		second.release();
		assertEquals( List.of( new ReleaseIMessage( 7, false, 1 ) ), sent );
		assertEquals( 0, table.countLive() );

		// A new generation of proxy acquires again
		sent.clear();
		RemoteProxy third = table.resolveRemote( 7 );
		assertNotSame( first, third );
		assertEquals( List.of( new AcquireIMessage( 7, false, 1 ) ), sent );
		third.release();
	}


	@Test
	public void invalidRemoteHandle() {
		StatusException ex = assertThrows( StatusException.class,
			() -> table.resolveRemote( 0 ) );
		assertEquals( Status.BAD_VALUE, ex.getStatus() );
	}


	@Test
	public void weakInterestInProxy() throws Exception {
		RemoteProxy proxy = table.resolveRemote( 3 );
		sent.clear();

		WeakObjectRef first = WeakObjectRef.of( proxy );
		WeakObjectRef second = WeakObjectRef.of( proxy );
		assertEquals( List.of( new AcquireIMessage( 3, true, 1 ) ), sent );

		RemoteObject promoted = first.promote();
		assertSame( proxy, promoted );
		promoted.release();

		first.release();
		first.release();
		assertEquals( 1, sent.size() );

		proxy.release();
		assertNull( second.promote() );

		second.release();
		assertEquals( new ReleaseIMessage( 3, true, 1 ), sent.get( sent.size() - 1 ) );
		assertEquals( 0, table.countLive() );
	}


	@Test
	public void weakInterestFromPeer() throws Exception {
		LocalObject object = new LocalObject( "test.Weak" );
		int handle = table.prepareSend( object );
		table.acquired( handle, false, 1 );
		table.acquired( handle, true, 1 );

		table.released( handle, false, 0 );
		assertEquals( 1, object.refCnt() );
		// The handle stays valid while weak interest remains
		assertEquals( 1, table.countLive() );

		LocalObject looked_up = table.lookupLocal( handle );
		assertSame( object, looked_up );
		looked_up.release();

		table.released( handle, true, 1 );
		assertEquals( 0, table.countLive() );
		object.release();
	}


	@Test
	public void lookupTargetErrors() throws Exception {
		StatusException unknown = assertThrows( StatusException.class,
			() -> table.lookupTarget( 99 ) );
		assertEquals( Status.INVALID_OPERATION, unknown.getStatus() );

		LocalObject object = new LocalObject( "test.Target" );
		int handle = table.exposeLocal( object );

		ObjectTable.Target target = table.lookupTarget( handle );
		assertSame( object, target.object );
		assertNotNull( target.oneway_queue );
		assertSame( target.oneway_queue, table.lookupTarget( handle ).oneway_queue );
		object.release( 2 );

		object.release();
		StatusException dead = assertThrows( StatusException.class,
			() -> table.lookupTarget( handle ) );
		assertEquals( Status.DEAD_OBJECT, dead.getStatus() );
	}


	@Test
	public void closeReleasesPins() throws Exception {
		LocalObject object = new LocalObject( "test.Close" );
		int handle = table.prepareSend( object );
		table.acquired( handle, false, 1 );
		object.release();
		assertEquals( 1, object.refCnt() );

		table.close();
		assertEquals( 0, object.refCnt() );
		assertTrue( table.isClosed() );

		StatusException ex = assertThrows( StatusException.class,
			() -> table.lookupTarget( handle ) );
		assertEquals( Status.DEAD_OBJECT, ex.getStatus() );
		assertThrows( StatusException.class, () -> table.resolveRemote( 5 ) );
	}


	@Test
	public void sendDestroyedObject() {
		LocalObject object = new LocalObject( "test.Dead" );
		object.release();

		StatusException ex = assertThrows( StatusException.class,
			() -> table.prepareSend( object ) );
		assertEquals( Status.DEAD_OBJECT, ex.getStatus() );
		assertEquals( 0, table.countLive() );
	}
}
