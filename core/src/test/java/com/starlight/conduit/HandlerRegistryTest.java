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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;


public class HandlerRegistryTest {
	@Test
	public void lookupWalksSuperclasses() {
		HandlerRegistry registry = new HandlerRegistry();
		TransactionHandler<LocalObject> base_handler =
			( target, code, data, reply, flags ) -> Status.OK;
		registry.register( LocalObject.class, base_handler );

		Child child = new Child( registry );
		assertSame( base_handler, registry.lookup( child ) );

		TransactionHandler<Child> child_handler =
			( target, code, data, reply, flags ) -> Status.BAD_VALUE;
		registry.register( Child.class, child_handler );
		assertSame( child_handler, registry.lookup( child ) );

		registry.unregister( Child.class );
		assertSame( base_handler, registry.lookup( child ) );

		child.release();
	}


	@Test
	public void noHandler() {
		HandlerRegistry registry = new HandlerRegistry();
		LocalObject object = new LocalObject( "test.Nothing", registry );
		assertNull( registry.lookup( object ) );

		try( Parcel data = new Parcel() ) {
			assertEquals( Status.UNKNOWN_TRANSACTION, object.transact( 5, data, null, 0 ) );
		}
		object.release();
	}


	private static class Child extends LocalObject {
		Child( HandlerRegistry registry ) {
			super( "test.Child", registry );
		}
	}
}
