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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;


/**
 * Object served by the test servers.
 */
class TestService extends LocalObject {
	static final String DESCRIPTOR = "conduit.test.TestService";

	static final int ECHO = RemoteObject.FIRST_CALL_TRANSACTION;
	static final int CALL_BACK = ECHO + 1;
	static final int STORE_CALLBACK = ECHO + 2;
	static final int CREATE_CHILD = ECHO + 3;
	static final int APPEND = ECHO + 4;
	static final int GET_APPENDED = ECHO + 5;
	static final int BARRIER = ECHO + 6;
	static final int DESCRIBE_CONTEXT = ECHO + 7;
	static final int FAIL = ECHO + 8;
	static final int SAME_BINDER = ECHO + 9;
	static final int NEST = ECHO + 10;
	static final int SLEEP = ECHO + 11;
	static final int BLOCK = ECHO + 12;

	static final int STATUS_CUSTOM = 1234;

	final List<Integer> appended = new CopyOnWriteArrayList<>();
	final AtomicInteger children_destroyed = new AtomicInteger();
	final AtomicReference<RemoteObject> stored_callback = new AtomicReference<>();
	final AtomicReference<Integer> callback_status = new AtomicReference<>();
	final CountDownLatch unblock = new CountDownLatch( 1 );
	final AtomicInteger blocked = new AtomicInteger();
	volatile CyclicBarrier barrier;


	TestService( HandlerRegistry registry ) {
		super( DESCRIPTOR, registry );
	}


	static void register( HandlerRegistry registry ) {
		registry.register( TestService.class, TestService::handle );
		registry.register( TestCallback.class, TestCallback::handle );
	}


	private static int handle( TestService service, int code, Parcel data, Parcel reply,
		int flags ) {

		switch( code ) {
			case ECHO:
				reply.writeString( data.readString() );
				return Status.OK;

			case CALL_BACK:
				return callBack( service, data, reply );

			case STORE_CALLBACK: {
				RemoteObject callback = data.readStrongBinder();
				RemoteObject previous = service.stored_callback.getAndSet(
					callback == null ? null : callback.retain() );
				Conduit.release( previous );
				return Status.OK;
			}

			case CREATE_CHILD: {
				LocalObject child = new LocalObject( "conduit.test.Child",
					service.getRegistry() );
				child.addDestroyListener( service.children_destroyed::incrementAndGet );
				reply.writeStrongBinder( child );
				child.release();
				return Status.OK;
			}

			case APPEND:
				service.appended.add( data.readInt() );
				return Status.OK;

			case GET_APPENDED: {
				List<Integer> copy = new ArrayList<>( service.appended );
				reply.writeInt( copy.size() );
				copy.forEach( reply::writeInt );
				return Status.OK;
			}

			case BARRIER:
				try {
					service.barrier.await( 10, TimeUnit.SECONDS );
					return Status.OK;
				}
				catch( InterruptedException ex ) {
					Thread.currentThread().interrupt();
					return Status.UNKNOWN_ERROR;
				}
				catch( BrokenBarrierException | TimeoutException ex ) {
					return Status.WOULD_BLOCK;
				}

			case DESCRIBE_CONTEXT:
				reply.writeBoolean( ConduitContext.isCall() );
				reply.writeBoolean( ConduitContext.isOneway() );
				reply.writeBoolean( ConduitContext.getServer() != null );
				reply.writeLong( ConduitContext.getSession().getSessionID() );
				return Status.OK;

			case FAIL: {
				int status = data.readInt();
				if ( status == Status.UNKNOWN_ERROR ) {
					throw new IllegalStateException( "Expected test exception" );
				}
				return status;
			}

			case SAME_BINDER: {
				RemoteObject first = data.readStrongBinder();
				RemoteObject second = data.readStrongBinder();
				reply.writeBoolean( first == second );
				reply.writeStrongBinder( first );
				return Status.OK;
			}

			case NEST:
				return nest( service, data, reply );

			case SLEEP:
				try {
					Thread.sleep( data.readInt() );
					return Status.OK;
				}
				catch( InterruptedException ex ) {
					Thread.currentThread().interrupt();
					return Status.UNKNOWN_ERROR;
				}

			case BLOCK:
				service.blocked.incrementAndGet();
				try {
					return service.unblock.await( 10, TimeUnit.SECONDS ) ?
						Status.OK : Status.WOULD_BLOCK;
				}
				catch( InterruptedException ex ) {
					Thread.currentThread().interrupt();
					return Status.UNKNOWN_ERROR;
				}
				finally {
					service.blocked.decrementAndGet();
				}

			default:
				return Status.UNKNOWN_TRANSACTION;
		}
	}


	/**
	 * Arguments: callback, value, one-way, delayed. An immediate two-way callback
	 * replies with the status and the callback's result. Otherwise the status is
	 * recorded in {@link #callback_status}.
	 */
	private static int callBack( TestService service, Parcel data, Parcel reply ) {
		RemoteObject callback = data.readStrongBinder();
		int value = data.readInt();
		int flags = data.readBoolean() ? RemoteObject.FLAG_ONEWAY : 0;
		boolean delayed = data.readBoolean();

		if ( delayed ) {
			RemoteObject target = callback == null ? null : callback.retain();
			ConduitContext.runLater( () -> {
				try {
					service.callback_status.set(
						notifyCallback( target, value, flags, null ) );
				}
				finally {
					Conduit.release( target );
				}
			}, 10, TimeUnit.MILLISECONDS );
			return Status.OK;
		}

		try( Parcel result = new Parcel() ) {
			int status = notifyCallback( callback, value, flags, result );
			service.callback_status.set( status );
			reply.writeInt( status );
			if ( status == Status.OK && flags == 0 ) reply.writeInt( result.readInt() );
			return Status.OK;
		}
	}


	private static int notifyCallback( RemoteObject callback, int value, int flags,
		Parcel result ) {

		try( Parcel args = new Parcel() ) {
			args.writeInt( value );
			return Conduit.transact( callback, TestCallback.NOTIFY, args, result, flags );
		}
	}


	/**
	 * Arguments: depth, peer. Calls NEST on the peer with one less depth and this
	 * object as the peer, replying with the depth reached.
	 */
	static int nest( LocalObject self, Parcel data, Parcel reply ) {
		int depth = data.readInt();
		RemoteObject peer = data.readStrongBinder();
		if ( depth == 0 ) {
			reply.writeInt( 0 );
			return Status.OK;
		}

		try( Parcel args = new Parcel(); Parcel result = new Parcel() ) {
			args.writeInt( depth - 1 );
			args.writeStrongBinder( self );
			int status = Conduit.transact( peer, NEST, args, result, 0 );
			if ( status != Status.OK ) return status;

			reply.writeInt( result.readInt() + 1 );
			return Status.OK;
		}
	}


	/**
	 * Object living in a client which the server calls back.
	 */
	static class TestCallback extends LocalObject {
		static final int NOTIFY = RemoteObject.FIRST_CALL_TRANSACTION;

		final List<Integer> received = new CopyOnWriteArrayList<>();
		final List<Boolean> received_in_call = new CopyOnWriteArrayList<>();

		TestCallback( HandlerRegistry registry ) {
			super( "conduit.test.TestCallback", registry );
		}

		private static int handle( TestCallback callback, int code, Parcel data,
			Parcel reply, int flags ) {

			if ( code == NEST ) return nest( callback, data, reply );
			if ( code != NOTIFY ) return Status.UNKNOWN_TRANSACTION;

			int value = data.readInt();
			callback.received.add( value );
			callback.received_in_call.add( ConduitContext.isCall() );
			reply.writeInt( value * 2 );
			return Status.OK;
		}
	}
}
